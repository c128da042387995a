package com.flamingo.ai.archiveqa.service.rag.generation;

import com.flamingo.ai.archiveqa.exception.LlmServiceException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;

/** {@link CompletionClient} backed by a LangChain4j {@link ChatModel}. */
@Slf4j
public class LangChain4jCompletionClient implements CompletionClient {

  private final ChatModel chatModel;
  private final String modelName;

  public LangChain4jCompletionClient(ChatModel chatModel, String modelName) {
    this.chatModel = chatModel;
    this.modelName = modelName;
  }

  @Override
  @Retry(name = "openai")
  public String complete(String systemPrompt, String userPrompt) {
    try {
      ChatResponse response =
          chatModel.chat(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
      String text = response.aiMessage().text();
      if (text == null || text.isBlank()) {
        throw new LlmServiceException("Model returned an empty completion", null);
      }
      return text;
    } catch (LlmServiceException e) {
      throw e;
    } catch (RateLimitException e) {
      log.warn("Completion rate limited by {}: {}", modelName, e.getMessage());
      throw new LlmServiceException(e.getMessage(), e, true);
    } catch (RuntimeException e) {
      log.error("Completion failed on {}: {}", modelName, e.getMessage());
      throw new LlmServiceException(e.getMessage(), e);
    }
  }

  @Override
  public String modelName() {
    return modelName;
  }
}

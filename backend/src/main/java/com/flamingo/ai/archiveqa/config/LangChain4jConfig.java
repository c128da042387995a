package com.flamingo.ai.archiveqa.config;

import com.flamingo.ai.archiveqa.service.rag.generation.CompletionCapability;
import com.flamingo.ai.archiveqa.service.rag.generation.CompletionClient;
import com.flamingo.ai.archiveqa.service.rag.generation.LangChain4jCompletionClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The chat and embedding models are only created when an API key is configured. Without one the
 * pipeline still answers, using the deterministic fallback answer and keyword retrieval.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  static final String API_KEY_PRESENT =
      "T(org.springframework.util.StringUtils).hasText('${langchain4j.openai.api-key:}')";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.timeout:60s}")
  private Duration chatTimeout;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  @ConditionalOnExpression(API_KEY_PRESENT)
  public ChatModel chatModel(RagConfig ragConfig) {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxTokens(ragConfig.getGeneration().getMaxTokens())
        .timeout(chatTimeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  @ConditionalOnExpression(API_KEY_PRESENT)
  public EmbeddingModel embeddingModel() {
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  @Bean
  @ConditionalOnExpression(API_KEY_PRESENT)
  public LangChain4jCompletionClient completionClient(ChatModel chatModel) {
    return new LangChain4jCompletionClient(chatModel, chatModelName);
  }

  @Bean
  public CompletionCapability completionCapability(ObjectProvider<CompletionClient> client) {
    CompletionClient available = client.getIfAvailable();
    if (available == null) {
      log.warn(
          "No OpenAI API key configured (OPENAI_API_KEY); answers use the fallback generator");
      return CompletionCapability.absent();
    }
    return CompletionCapability.available(available);
  }
}

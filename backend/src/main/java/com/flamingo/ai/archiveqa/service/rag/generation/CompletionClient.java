package com.flamingo.ai.archiveqa.service.rag.generation;

/** A language model that turns a system and user prompt into a completion. */
public interface CompletionClient {

  /**
   * Runs one completion.
   *
   * @throws com.flamingo.ai.archiveqa.exception.LlmServiceException if the model call fails
   */
  String complete(String systemPrompt, String userPrompt);

  /** Name of the underlying model, reported on answers. */
  String modelName();
}

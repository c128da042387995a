package com.flamingo.ai.archiveqa.service.rag.model;

/**
 * A question to answer from the archive.
 *
 * @param text the natural-language question
 * @param scope workspace the question is asked in
 * @param channelFilter explicit channel name restriction, or null to let intent detection decide
 * @param daysBack explicit time window in days, or null to let intent detection decide
 * @param maxContextMessages upper bound on filtered messages handed to the model
 */
public record Question(
    String text,
    WorkspaceScope scope,
    String channelFilter,
    Integer daysBack,
    int maxContextMessages) {

  public static final int DEFAULT_CONTEXT_MESSAGES = 10;

  public static Question of(WorkspaceScope scope, String text) {
    return new Question(text, scope, null, null, DEFAULT_CONTEXT_MESSAGES);
  }
}

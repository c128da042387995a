package com.flamingo.ai.archiveqa.exception;

/** Exception thrown when the completion model call fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "AI service rate limit reached. Please wait a moment and try again."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

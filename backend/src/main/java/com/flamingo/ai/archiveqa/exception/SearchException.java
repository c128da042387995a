package com.flamingo.ai.archiveqa.exception;

/** Thrown when the message archive cannot be searched. Never masked as an empty result. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Retrieval failed. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}

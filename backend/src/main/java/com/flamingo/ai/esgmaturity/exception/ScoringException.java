package com.flamingo.ai.esgmaturity.exception;

/** Base type for every failure raised by the retrieval and scoring engine. */
public abstract class ScoringException extends RuntimeException {

  private final String userMessage;

  protected ScoringException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected ScoringException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

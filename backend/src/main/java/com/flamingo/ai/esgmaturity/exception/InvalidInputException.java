package com.flamingo.ai.esgmaturity.exception;

/** Caller-supplied data violates a precondition. */
public class InvalidInputException extends ScoringException {

  public InvalidInputException(String message) {
    super(message, message);
  }
}

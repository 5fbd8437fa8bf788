package com.flamingo.ai.esgmaturity.exception;

/** A score or parity artifact could not be written. */
public class ArtifactException extends ScoringException {

  public ArtifactException(String message, Throwable cause) {
    super(message, "Failed to store scoring artifacts", cause);
  }
}

package com.flamingo.ai.esgmaturity.exception;

/** Missing or invalid configuration; the engine refuses to run. */
public class ConfigException extends ScoringException {

  public ConfigException(String message) {
    super(message, "Scoring engine is misconfigured");
  }

  public ConfigException(String message, Throwable cause) {
    super(message, "Scoring engine is misconfigured", cause);
  }
}

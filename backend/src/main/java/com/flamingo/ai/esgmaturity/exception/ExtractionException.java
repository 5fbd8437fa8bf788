package com.flamingo.ai.esgmaturity.exception;

/** A resolved document could not be turned into text spans. */
public class ExtractionException extends ScoringException {

  private final String documentHash;

  public ExtractionException(String documentHash, String message) {
    super(message, "Failed to read report content");
    this.documentHash = documentHash;
  }

  public ExtractionException(String documentHash, String message, Throwable cause) {
    super(message, "Failed to read report content", cause);
    this.documentHash = documentHash;
  }

  public String getDocumentHash() {
    return documentHash;
  }
}

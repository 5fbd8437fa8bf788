package com.flamingo.ai.esgmaturity.exception;

/**
 * Raised by a report provider when a search or download fails. Absorbed by the resolver: it never
 * propagates past a search, and a failed download only moves resolution to the next candidate.
 */
public class ProviderException extends ScoringException {

  private final String providerId;

  public ProviderException(String providerId, String message) {
    super(message, "Report provider unavailable");
    this.providerId = providerId;
  }

  public ProviderException(String providerId, String message, Throwable cause) {
    super(message, "Report provider unavailable", cause);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}

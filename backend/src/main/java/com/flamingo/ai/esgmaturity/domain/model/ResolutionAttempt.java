package com.flamingo.ai.esgmaturity.domain.model;

/**
 * A failed download attempt recorded while resolving the best document.
 *
 * @param rank 1-based position of the candidate in priority order
 * @param providerId provider that was asked to download
 * @param tier candidate tier
 * @param priorityScore candidate priority
 * @param error message of the underlying failure
 */
public record ResolutionAttempt(
    int rank, String providerId, int tier, int priorityScore, String error) {

  public static ResolutionAttempt failed(int rank, SourceCandidate candidate, Throwable error) {
    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    return new ResolutionAttempt(
        rank, candidate.providerId(), candidate.tier(), candidate.priorityScore(), message);
  }
}

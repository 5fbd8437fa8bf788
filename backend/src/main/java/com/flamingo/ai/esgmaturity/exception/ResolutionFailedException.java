package com.flamingo.ai.esgmaturity.exception;

import com.flamingo.ai.esgmaturity.domain.model.ResolutionAttempt;
import java.util.List;

/** No usable document could be obtained after exhausting every candidate. */
public class ResolutionFailedException extends ScoringException {

  private final String orgId;
  private final int year;
  private final List<ResolutionAttempt> attempts;

  public ResolutionFailedException(
      String orgId, int year, List<ResolutionAttempt> attempts, Throwable lastError) {
    super(buildMessage(orgId, year, attempts, lastError), "No usable report found", lastError);
    this.orgId = orgId;
    this.year = year;
    this.attempts = List.copyOf(attempts);
  }

  private static String buildMessage(
      String orgId, int year, List<ResolutionAttempt> attempts, Throwable lastError) {
    if (attempts.isEmpty()) {
      return String.format("No report candidates found for %s (%d)", orgId, year);
    }
    return String.format(
        "Failed to resolve report for %s (%d) after %d attempts. Last error: %s",
        orgId, year, attempts.size(), lastError == null ? "n/a" : lastError.getMessage());
  }

  public String getOrgId() {
    return orgId;
  }

  public int getYear() {
    return year;
  }

  public int getAttemptCount() {
    return attempts.size();
  }

  public List<ResolutionAttempt> getAttempts() {
    return attempts;
  }
}

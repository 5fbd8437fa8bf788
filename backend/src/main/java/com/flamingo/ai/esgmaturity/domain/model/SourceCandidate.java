package com.flamingo.ai.esgmaturity.domain.model;

import com.flamingo.ai.esgmaturity.domain.enums.AccessMethod;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.time.LocalDate;
import lombok.Builder;

/**
 * One provider's pointer to a possible report. Immutable; ordering is by {@code (tier,
 * priorityScore)}, both ascending.
 *
 * @param providerId id of the provider that produced the candidate and must download it
 * @param tier quality tier, 1 (best) to 3 (worst)
 * @param priorityScore priority inside the tier, 0 (preferred) to 100
 * @param access how the report is reached
 * @param contentType MIME type of the report
 * @param url optional location of the report
 * @param publishedOn optional publication date, used for evidence freshness
 */
@Builder(toBuilder = true)
public record SourceCandidate(
    String providerId,
    int tier,
    int priorityScore,
    AccessMethod access,
    String contentType,
    String url,
    LocalDate publishedOn) {

  public static final int MIN_TIER = 1;
  public static final int MAX_TIER = 3;
  public static final int MIN_PRIORITY = 0;
  public static final int MAX_PRIORITY = 100;

  public SourceCandidate {
    if (providerId == null || providerId.isBlank()) {
      throw new InvalidInputException("providerId is required");
    }
    if (tier < MIN_TIER || tier > MAX_TIER) {
      throw new InvalidInputException("tier must be in [1,3], got " + tier);
    }
    if (priorityScore < MIN_PRIORITY || priorityScore > MAX_PRIORITY) {
      throw new InvalidInputException("priority_score must be in [0,100], got " + priorityScore);
    }
    if (access == null) {
      access = AccessMethod.API;
    }
    if (contentType == null || contentType.isBlank()) {
      throw new InvalidInputException("contentType is required");
    }
  }
}

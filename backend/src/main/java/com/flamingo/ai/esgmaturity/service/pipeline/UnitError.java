package com.flamingo.ai.esgmaturity.service.pipeline;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.esgmaturity.domain.enums.UnitErrorType;

/**
 * Structured failure of one unit, reported next to the successful units of the same batch.
 *
 * @param attempts download attempts made before giving up, 0 when not applicable
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnitError(
    String orgId, int year, String theme, UnitErrorType type, String message, int attempts) {

  static UnitError of(ScoringUnit unit, UnitErrorType type, String message, int attempts) {
    return new UnitError(unit.company().id(), unit.year(), unit.themeId(), type, message, attempts);
  }
}

package com.flamingo.ai.esgmaturity.service.pipeline;

import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;

/**
 * Result of one unit: either a score with its passing parity report, or an error. A parity failure
 * carries the failing report and no score.
 */
public record UnitOutcome(
    ScoringUnit unit, StageScore score, ParityReport parity, UnitError error) {

  static UnitOutcome success(ScoringUnit unit, StageScore score, ParityReport parity) {
    return new UnitOutcome(unit, score, parity, null);
  }

  static UnitOutcome failure(ScoringUnit unit, UnitError error, ParityReport parity) {
    return new UnitOutcome(unit, null, parity, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}

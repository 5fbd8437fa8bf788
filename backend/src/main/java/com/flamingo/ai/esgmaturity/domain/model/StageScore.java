package com.flamingo.ai.esgmaturity.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.util.List;

/**
 * Theme-level maturity verdict for one organisation and year.
 *
 * @param orgId organisation id
 * @param year fiscal year
 * @param theme rubric theme id
 * @param stage maturity stage 0..4, 0 being the safe default
 * @param confidence confidence in [0,1]
 * @param evidenceIds ids of the distinct quotes backing the stage, sorted
 * @param sourceIds ranked text unit ids the backing quotes were taken from, sorted; these are the
 *     ids checked against the ranking top-K
 * @param snapshotId deterministic id of the run
 * @param audit human-readable notes on how the stage was reached
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "org_id",
  "year",
  "theme",
  "stage",
  "confidence",
  "evidence_ids",
  "source_ids",
  "snapshot_id",
  "audit"
})
public record StageScore(
    String orgId,
    int year,
    String theme,
    int stage,
    double confidence,
    List<String> evidenceIds,
    List<String> sourceIds,
    String snapshotId,
    List<String> audit) {

  public static final int MIN_STAGE = 0;
  public static final int MAX_STAGE = 4;

  public StageScore {
    if (stage < MIN_STAGE || stage > MAX_STAGE) {
      throw new InvalidInputException("stage must be in [0,4], got " + stage);
    }
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new InvalidInputException("confidence must be in [0,1], got " + confidence);
    }
    evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
    sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
    audit = audit == null ? List.of() : List.copyOf(audit);
    if (stage > MIN_STAGE && evidenceIds.isEmpty()) {
      throw new InvalidInputException("stage " + stage + " requires evidence");
    }
  }
}

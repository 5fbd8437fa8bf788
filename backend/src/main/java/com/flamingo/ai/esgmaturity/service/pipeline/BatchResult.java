package com.flamingo.ai.esgmaturity.service.pipeline;

import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import java.util.List;
import java.util.Objects;

/** Outcomes of a batch in canonical unit order. */
public record BatchResult(String snapshotId, List<UnitOutcome> outcomes) {

  public BatchResult {
    outcomes = List.copyOf(outcomes);
  }

  public List<StageScore> scores() {
    return outcomes.stream().map(UnitOutcome::score).filter(Objects::nonNull).toList();
  }

  public List<ParityReport> parityReports() {
    return outcomes.stream().map(UnitOutcome::parity).filter(Objects::nonNull).toList();
  }

  public List<UnitError> errors() {
    return outcomes.stream().map(UnitOutcome::error).filter(Objects::nonNull).toList();
  }
}

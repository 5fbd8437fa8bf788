package com.flamingo.ai.esgmaturity.api.dto.response;

import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.service.pipeline.BatchResult;
import com.flamingo.ai.esgmaturity.service.pipeline.UnitError;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a scoring batch; failed units are listed in {@code errors}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringRunResponse {

  private String snapshotId;
  private List<StageScore> scores;
  private List<ParityReport> parityReports;
  private List<UnitError> errors;

  public static ScoringRunResponse from(BatchResult result) {
    return ScoringRunResponse.builder()
        .snapshotId(result.snapshotId())
        .scores(result.scores())
        .parityReports(result.parityReports())
        .errors(result.errors())
        .build();
  }
}

package com.flamingo.ai.esgmaturity.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.esgmaturity.domain.enums.ParityVerdict;
import java.util.List;

/**
 * Result of checking that cited evidence is contained in the ranking top-K. All id lists are
 * sorted.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"query", "evidence_ids", "top_k_ids", "verdict", "missing_ids"})
public record ParityReport(
    String query,
    List<String> evidenceIds,
    List<String> topKIds,
    ParityVerdict verdict,
    List<String> missingIds) {

  public ParityReport {
    evidenceIds = List.copyOf(evidenceIds);
    topKIds = List.copyOf(topKIds);
    missingIds = List.copyOf(missingIds);
  }

  @JsonIgnore
  public boolean passed() {
    return verdict == ParityVerdict.PASS;
  }
}

package com.flamingo.ai.esgmaturity.exception;

import com.flamingo.ai.esgmaturity.domain.model.ParityReport;

/**
 * Evidence cited by a score is not part of the ranking top-K. Signals a logic defect in the
 * pipeline, not bad external data.
 */
public class ParityViolationException extends ScoringException {

  private final ParityReport report;

  public ParityViolationException(ParityReport report) {
    super(
        String.format(
            "Parity violation for query '%s': %d evidence ids not in top-k %s",
            report.query(), report.missingIds().size(), report.missingIds()),
        "Score evidence failed the parity check");
    this.report = report;
  }

  public ParityReport getReport() {
    return report;
  }
}

package com.flamingo.ai.esgmaturity.service.parity;

import com.flamingo.ai.esgmaturity.domain.enums.ParityVerdict;
import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.exception.ParityViolationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks that every evidence id cited for a score is contained in the ranking top-K for the same
 * query. A failure is a pipeline defect and is logged as a parity alarm.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParityValidator {

  private final MeterRegistry meterRegistry;

  /**
   * Pure subset check.
   *
   * @return a report whose id lists are sorted; {@code missingIds} is exactly {@code evidenceIds \
   *     topKIds}
   */
  public ParityReport check(
      String query, Collection<String> evidenceIds, Collection<String> topKIds) {
    TreeSet<String> evidence = new TreeSet<>(evidenceIds);
    TreeSet<String> topK = new TreeSet<>(topKIds);
    TreeSet<String> missing = new TreeSet<>(evidence);
    missing.removeAll(topK);
    ParityVerdict verdict = missing.isEmpty() ? ParityVerdict.PASS : ParityVerdict.FAIL;
    meterRegistry
        .counter(verdict == ParityVerdict.PASS ? "scoring.parity.pass" : "scoring.parity.fail")
        .increment();
    return new ParityReport(
        query, List.copyOf(evidence), List.copyOf(topK), verdict, List.copyOf(missing));
  }

  /**
   * Throws when the report failed.
   *
   * @throws ParityViolationException carrying the report
   */
  public void enforce(ParityReport report) {
    if (!report.passed()) {
      log.error(
          "[PARITY-ALARM] query='{}' missing={} top_k={}",
          report.query(),
          report.missingIds(),
          report.topKIds());
      throw new ParityViolationException(report);
    }
  }
}

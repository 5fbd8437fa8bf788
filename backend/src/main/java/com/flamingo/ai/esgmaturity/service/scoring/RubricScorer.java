package com.flamingo.ai.esgmaturity.service.scoring;

import com.flamingo.ai.esgmaturity.domain.model.EvidenceQuote;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricStage;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies a theme into a maturity stage from quoted evidence.
 *
 * <p>The highest stage supported by at least one quote is chosen. If fewer than the theme's
 * minimum of distinct quotes support it, the score is demoted to stage 0 with confidence 0.0 and
 * the shortfall is recorded in the audit trail. Quotes are distinct by content hash, or by
 * evidence id when a quote carries no hash.
 *
 * <p>Confidence for a stage above 0 is {@code 0.60 + 0.05 * stage + 0.20 * coverage} minus the
 * mean freshness penalty of the supporting quotes, clamped to [0,1] and rounded half-even to four
 * decimals. Coverage is the share of the stage's signals found in the supporting quotes.
 */
@Service
@Slf4j
public class RubricScorer {

  static final double BASE_CONFIDENCE = 0.60;
  static final double STAGE_WEIGHT = 0.05;
  static final double COVERAGE_WEIGHT = 0.20;

  private final Rubric rubric;
  private final FreshnessPolicy freshnessPolicy;
  private final MeterRegistry meterRegistry;

  public RubricScorer(Rubric rubric, FreshnessPolicy freshnessPolicy, MeterRegistry meterRegistry) {
    if (rubric == null) {
      throw new ConfigException("Rubric definition is required to score");
    }
    this.rubric = rubric;
    this.freshnessPolicy = freshnessPolicy;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Scores one theme.
   *
   * @param themeId rubric theme id
   * @param evidence quotes extracted for the theme, may be empty
   * @param orgId organisation id
   * @param year fiscal year
   * @param snapshotId run identifier
   * @param context supplies the reference date for freshness
   * @throws com.flamingo.ai.esgmaturity.exception.InvalidInputException for an unknown theme
   */
  public StageScore score(
      String themeId,
      List<EvidenceQuote> evidence,
      String orgId,
      int year,
      String snapshotId,
      DeterminismContext context) {
    RubricTheme theme = rubric.requireTheme(themeId);
    int minQuotes = rubric.minQuotesFor(theme);
    List<EvidenceQuote> distinct = distinctByContent(evidence);
    List<String> audit = new ArrayList<>();
    audit.add("rubric_version=" + rubric.version());
    audit.add("distinct_evidence=" + distinct.size());

    RubricStage chosen = null;
    List<EvidenceQuote> supporting = List.of();
    List<RubricStage> stages = theme.stages();
    for (int i = stages.size() - 1; i >= 0; i--) {
      RubricStage stage = stages.get(i);
      List<EvidenceQuote> matching =
          distinct.stream().filter(q -> stage.matches(q.quote())).toList();
      if (!matching.isEmpty()) {
        chosen = stage;
        supporting = matching;
        break;
      }
    }

    if (chosen == null) {
      audit.add("no_stage_matched");
      return stageZero(orgId, year, theme, snapshotId, audit);
    }

    audit.add(
        String.format(
            Locale.ROOT,
            "stage %d (%s) matched by %d quote(s)",
            chosen.stage(),
            chosen.label(),
            supporting.size()));
    if (supporting.size() < minQuotes) {
      audit.add(
          String.format(
              Locale.ROOT,
              "insufficient_evidence(%d<%d MIN_QUOTES)",
              supporting.size(),
              minQuotes));
      meterRegistry.counter("scoring.rubric.gate.demotions").increment();
      log.info(
          "Demoted {} {} {} from stage {} to 0: {} of {} required quotes",
          orgId,
          year,
          theme.id(),
          chosen.stage(),
          supporting.size(),
          minQuotes);
      return stageZero(orgId, year, theme, snapshotId, audit);
    }

    Set<String> signals = new TreeSet<>();
    double penaltySum = 0.0;
    for (EvidenceQuote quote : supporting) {
      signals.addAll(chosen.matchedSignals(quote.quote()));
      penaltySum += freshnessPolicy.penalty(quote.publishedOn(), context.today());
    }
    double coverage = (double) signals.size() / chosen.signalCount();
    double meanPenalty = penaltySum / supporting.size();
    double confidence =
        round(
            clamp(
                BASE_CONFIDENCE
                    + STAGE_WEIGHT * chosen.stage()
                    + COVERAGE_WEIGHT * coverage
                    - meanPenalty));
    audit.add(
        String.format(
            Locale.ROOT,
            "coverage=%d/%d freshness_penalty=%.4f",
            signals.size(),
            chosen.signalCount(),
            meanPenalty));

    List<String> evidenceIds =
        supporting.stream().map(EvidenceQuote::evidenceId).distinct().sorted().toList();
    List<String> sourceIds =
        supporting.stream().map(EvidenceQuote::documentId).distinct().sorted().toList();
    return new StageScore(
        orgId,
        year,
        theme.id(),
        chosen.stage(),
        confidence,
        evidenceIds,
        sourceIds,
        snapshotId,
        audit);
  }

  private static StageScore stageZero(
      String orgId, int year, RubricTheme theme, String snapshotId, List<String> audit) {
    return new StageScore(
        orgId, year, theme.id(), 0, 0.0, List.of(), List.of(), snapshotId, audit);
  }

  private static List<EvidenceQuote> distinctByContent(List<EvidenceQuote> evidence) {
    Map<String, EvidenceQuote> byHash = new LinkedHashMap<>();
    if (evidence != null) {
      for (EvidenceQuote quote : evidence) {
        if (quote != null) {
          String key =
              quote.contentHash() != null ? quote.contentHash() : "id:" + quote.evidenceId();
          byHash.putIfAbsent(key, quote);
        }
      }
    }
    return List.copyOf(byHash.values());
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static double round(double value) {
    return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
  }
}

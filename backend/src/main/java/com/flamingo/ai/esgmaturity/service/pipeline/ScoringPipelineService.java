package com.flamingo.ai.esgmaturity.service.pipeline;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.enums.UnitErrorType;
import com.flamingo.ai.esgmaturity.domain.model.EvidenceQuote;
import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.RankCandidate;
import com.flamingo.ai.esgmaturity.domain.model.RankedResult;
import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.domain.model.TextSpan;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.exception.ExtractionException;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import com.flamingo.ai.esgmaturity.exception.ParityViolationException;
import com.flamingo.ai.esgmaturity.exception.ResolutionFailedException;
import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import com.flamingo.ai.esgmaturity.service.determinism.SnapshotIdGenerator;
import com.flamingo.ai.esgmaturity.service.extraction.TextExtractorRouter;
import com.flamingo.ai.esgmaturity.service.parity.ParityValidator;
import com.flamingo.ai.esgmaturity.service.ranking.Bm25LexicalScorer;
import com.flamingo.ai.esgmaturity.service.ranking.HybridRanker;
import com.flamingo.ai.esgmaturity.service.resolver.CandidateResolver;
import com.flamingo.ai.esgmaturity.service.scoring.EvidenceExtractor;
import com.flamingo.ai.esgmaturity.service.scoring.RubricScorer;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import com.flamingo.ai.esgmaturity.service.storage.ArtifactStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs Resolve, Extract, Rank, Score and Validate for scoring units.
 *
 * <p>Stages within a unit are strictly sequential. Units of a batch run in parallel on the scoring
 * executor and share nothing mutable; their outcomes are re-sorted by org id, year and theme
 * before they are returned. A failed unit becomes a {@link UnitError} next to the successful ones,
 * except a {@link ConfigException}, which aborts the whole batch. A unit the executor refuses is
 * recorded as {@link UnitErrorType#REJECTED}.
 */
@Service
@Slf4j
public class ScoringPipelineService {

  private final CandidateResolver candidateResolver;
  private final TextExtractorRouter textExtractorRouter;
  private final Bm25LexicalScorer lexicalScorer;
  private final HybridRanker hybridRanker;
  private final EvidenceExtractor evidenceExtractor;
  private final RubricScorer rubricScorer;
  private final ParityValidator parityValidator;
  private final ArtifactStore artifactStore;
  private final Rubric rubric;
  private final DeterminismContext determinismContext;
  private final ScoringConfig scoringConfig;
  private final MeterRegistry meterRegistry;
  private final Executor scoringUnitExecutor;

  public ScoringPipelineService(
      CandidateResolver candidateResolver,
      TextExtractorRouter textExtractorRouter,
      Bm25LexicalScorer lexicalScorer,
      HybridRanker hybridRanker,
      EvidenceExtractor evidenceExtractor,
      RubricScorer rubricScorer,
      ParityValidator parityValidator,
      ArtifactStore artifactStore,
      Rubric rubric,
      DeterminismContext determinismContext,
      ScoringConfig scoringConfig,
      MeterRegistry meterRegistry,
      @Qualifier("scoringUnitExecutor") Executor scoringUnitExecutor) {
    this.candidateResolver = candidateResolver;
    this.textExtractorRouter = textExtractorRouter;
    this.lexicalScorer = lexicalScorer;
    this.hybridRanker = hybridRanker;
    this.evidenceExtractor = evidenceExtractor;
    this.rubricScorer = rubricScorer;
    this.parityValidator = parityValidator;
    this.artifactStore = artifactStore;
    this.rubric = rubric;
    this.determinismContext = determinismContext;
    this.scoringConfig = scoringConfig;
    this.meterRegistry = meterRegistry;
    this.scoringUnitExecutor = scoringUnitExecutor;
  }

  /** Runs a batch with the configured alpha and top-K. */
  public BatchResult runBatch(List<ScoringUnit> units) {
    return runBatch(
        units,
        scoringConfig.getRetrieval().getAlpha(),
        scoringConfig.getRetrieval().getTopK(),
        CancellationToken.none());
  }

  /**
   * Runs every unit and collects their outcomes.
   *
   * @throws InvalidInputException if the batch is empty, alpha or top-K is out of range, or a unit
   *     names an unknown theme
   * @throws ConfigException if the engine is misconfigured; no partial result is returned
   */
  @Timed(value = "scoring.pipeline.batch", description = "Time to run a scoring batch")
  public BatchResult runBatch(
      List<ScoringUnit> units, double alpha, int topK, CancellationToken token) {
    if (units == null || units.isEmpty()) {
      throw new InvalidInputException("at least one scoring unit is required");
    }
    if (!Double.isFinite(alpha) || alpha < 0.0 || alpha > 1.0) {
      throw new InvalidInputException("alpha must be in [0,1], got " + alpha);
    }
    if (topK < 0) {
      throw new InvalidInputException("top_k must be >= 0, got " + topK);
    }
    for (ScoringUnit unit : units) {
      rubric.requireTheme(unit.themeId());
    }

    String snapshotId = snapshotId(units, alpha, topK);
    log.info(
        "Starting batch {} with {} units (alpha={}, k={})", snapshotId, units.size(), alpha, topK);

    List<CompletableFuture<UnitOutcome>> futures = new ArrayList<>();
    for (ScoringUnit unit : units) {
      futures.add(submit(unit, snapshotId, alpha, topK, token));
    }

    List<UnitOutcome> outcomes = new ArrayList<>();
    for (CompletableFuture<UnitOutcome> future : futures) {
      try {
        outcomes.add(future.join());
      } catch (CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
          throw cause;
        }
        throw e;
      }
    }
    outcomes.sort(Comparator.comparing(UnitOutcome::unit, ScoringUnit.CANONICAL_ORDER));

    BatchResult result = new BatchResult(snapshotId, outcomes);
    log.info(
        "Finished batch {}: {} scored, {} failed",
        snapshotId,
        result.scores().size(),
        result.errors().size());
    return result;
  }

  /**
   * Runs one unit to completion or to a structured error. Never returns a partial score.
   *
   * @throws ConfigException if the engine is misconfigured
   */
  public UnitOutcome runUnit(
      ScoringUnit unit, String snapshotId, double alpha, int topK, CancellationToken token) {
    String orgId = unit.company().id();
    try {
      RubricTheme theme = rubric.requireTheme(unit.themeId());
      String query = unit.query() != null ? unit.query() : theme.query();

      token.throwIfCancelled("resolve");
      log.info("[{}] Resolving report for {} ({})", theme.id(), orgId, unit.year());
      ResolvedDocument document = candidateResolver.resolveBest(unit.company(), unit.year());

      token.throwIfCancelled("extract");
      List<TextSpan> spans = textExtractorRouter.extract(document);
      if (spans.isEmpty()) {
        throw new ExtractionException(document.contentHash(), "Document contains no text");
      }

      token.throwIfCancelled("rank");
      LocalDate publishedOn =
          document.source().publishedOn() != null
              ? document.source().publishedOn()
              : LocalDate.of(unit.year(), 12, 31);
      List<RankCandidate> candidates = lexicalScorer.score(query, spans, publishedOn);
      List<RankedResult> ranked =
          hybridRanker.rank(query, candidates, alpha, topK, determinismContext);
      log.info("[{}] Ranked {} spans for {}, top-{} kept", theme.id(), spans.size(), orgId, topK);

      token.throwIfCancelled("score");
      Map<String, RankCandidate> byId = new LinkedHashMap<>();
      candidates.forEach(c -> byId.put(c.documentId(), c));
      List<EvidenceQuote> quotes = evidenceExtractor.extract(theme, ranked, byId);
      StageScore score =
          rubricScorer.score(
              theme.id(), quotes, orgId, unit.year(), snapshotId, determinismContext);

      token.throwIfCancelled("validate");
      // Only the quotes the score cites are checked, by the id of the span they came from.
      ParityReport parity =
          parityValidator.check(
              query, score.sourceIds(), ranked.stream().map(RankedResult::documentId).toList());
      if (scoringConfig.getArtifacts().isEnabled()) {
        artifactStore.writeParity(snapshotId, orgId, unit.year(), theme.id(), parity);
      }
      parityValidator.enforce(parity);
      if (scoringConfig.getArtifacts().isEnabled()) {
        artifactStore.writeScore(score);
      }

      meterRegistry.counter("scoring.pipeline.unit.success").increment();
      log.info(
          "[{}] Scored {} ({}) at stage {} with confidence {}",
          theme.id(),
          orgId,
          unit.year(),
          score.stage(),
          score.confidence());
      return UnitOutcome.success(unit, score, parity);

    } catch (CancellationException e) {
      return failed(unit, UnitErrorType.CANCELLED, e.getMessage(), 0, null);
    } catch (ResolutionFailedException e) {
      return failed(
          unit, UnitErrorType.RESOLUTION_FAILED, e.getMessage(), e.getAttemptCount(), null);
    } catch (ExtractionException e) {
      return failed(unit, UnitErrorType.EXTRACTION_FAILED, e.getMessage(), 0, null);
    } catch (ParityViolationException e) {
      return failed(unit, UnitErrorType.PARITY_VIOLATION, e.getMessage(), 0, e.getReport());
    } catch (InvalidInputException e) {
      return failed(unit, UnitErrorType.INVALID_INPUT, e.getMessage(), 0, null);
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("[{}] Unexpected failure scoring {}: {}", unit.themeId(), orgId, e.getMessage(), e);
      return failed(unit, UnitErrorType.INTERNAL, e.getMessage(), 0, null);
    }
  }

  private CompletableFuture<UnitOutcome> submit(
      ScoringUnit unit, String snapshotId, double alpha, int topK, CancellationToken token) {
    try {
      return CompletableFuture.supplyAsync(
          () -> runUnit(unit, snapshotId, alpha, topK, token), scoringUnitExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(
          failed(
              unit,
              UnitErrorType.REJECTED,
              "Scoring executor did not accept the unit: " + e.getMessage(),
              0,
              null));
    }
  }

  /** Deterministic id over the sorted units and every parameter that affects output. */
  public String snapshotId(List<ScoringUnit> units, double alpha, int topK) {
    Comparator<ScoringUnit> order =
        ScoringUnit.CANONICAL_ORDER.thenComparing(u -> u.query() == null ? "" : u.query());
    List<Map<String, Object>> canonicalUnits = new ArrayList<>();
    units.stream()
        .sorted(order)
        .forEach(
            unit -> {
              Map<String, Object> entry = new TreeMap<>();
              entry.put("org", unit.company().id());
              entry.put("year", unit.year());
              entry.put("theme", unit.themeId());
              entry.put("query", unit.query() == null ? "" : unit.query());
              canonicalUnits.add(entry);
            });

    Map<String, Object> parameters = new TreeMap<>();
    parameters.put("units", canonicalUnits);
    parameters.put("alpha", alpha);
    parameters.put("top_k", topK);
    parameters.put("seed", determinismContext.seed());
    parameters.put(
        "clock",
        determinismContext.isDeterministic() ? determinismContext.now().toString() : "live");
    parameters.put("rubric_version", rubric.version());
    parameters.put("max_quotes", scoringConfig.getRetrieval().getMaxQuotesPerTheme());
    parameters.put("quote_max_words", scoringConfig.getRetrieval().getQuoteMaxWords());
    return SnapshotIdGenerator.generate(parameters);
  }

  private UnitOutcome failed(
      ScoringUnit unit, UnitErrorType type, String message, int attempts, ParityReport parity) {
    meterRegistry.counter("scoring.pipeline.unit.failure", "type", type.name()).increment();
    log.warn(
        "[{}] Unit {} ({}) failed with {}: {}",
        unit.themeId(),
        unit.company().id(),
        unit.year(),
        type,
        message);
    return UnitOutcome.failure(unit, UnitError.of(unit, type, message, attempts), parity);
  }
}

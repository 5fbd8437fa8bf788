package com.flamingo.ai.esgmaturity.service.ranking;

import com.flamingo.ai.esgmaturity.domain.model.RankCandidate;
import com.flamingo.ai.esgmaturity.domain.model.RankedResult;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fuses a precomputed lexical score with a semantic score and returns a deterministic top-K.
 *
 * <p>Both signals are clamped to [0,1], fused as {@code alpha * lexical + (1 - alpha) * semantic}
 * and sorted by {@link RankedResult#TOTAL_ORDER}. The fusion and tie-break rules do not depend on
 * which {@link SemanticScorer} is plugged in. Pure computation, no I/O.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRanker {

  private final SemanticScorer semanticScorer;
  private final MeterRegistry meterRegistry;

  /**
   * Ranks candidates for a query.
   *
   * @param query search query
   * @param candidates non-empty list of candidates with unique document ids
   * @param alpha lexical weight in [0,1]
   * @param k number of results to keep; may exceed the candidate count, 0 yields an empty list
   * @param context determinism context handed to the semantic scorer
   * @return at most {@code k} results with 1-based ranks
   * @throws InvalidInputException on empty candidates, bad alpha or k, duplicate ids, or a
   *     non-finite score
   */
  public List<RankedResult> rank(
      String query,
      List<RankCandidate> candidates,
      double alpha,
      int k,
      DeterminismContext context) {
    if (candidates == null || candidates.isEmpty()) {
      throw new InvalidInputException("no candidates");
    }
    if (!Double.isFinite(alpha) || alpha < 0.0 || alpha > 1.0) {
      throw new InvalidInputException("alpha must be in [0,1], got " + alpha);
    }
    if (k < 0) {
      throw new InvalidInputException("k must be >= 0, got " + k);
    }
    meterRegistry.counter("scoring.ranker.invocations").increment();

    Set<String> seen = new HashSet<>();
    List<String> texts = new ArrayList<>(candidates.size());
    for (RankCandidate candidate : candidates) {
      if (!seen.add(candidate.documentId())) {
        throw new InvalidInputException("duplicate document id: " + candidate.documentId());
      }
      texts.add(candidate.text());
    }

    double[] semantic = semanticScorer.score(query, texts, context);
    if (semantic.length != candidates.size()) {
      throw new IllegalStateException(
          "Semantic scorer returned "
              + semantic.length
              + " scores for "
              + candidates.size()
              + " candidates");
    }

    List<RankedResult> results = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      RankCandidate candidate = candidates.get(i);
      double lexical = candidate.lexicalScore();
      if (!Double.isFinite(lexical) || !Double.isFinite(semantic[i])) {
        throw new InvalidInputException("nan/inf score for " + candidate.documentId());
      }
      double lex = clamp(lexical);
      double sem = clamp(semantic[i]);
      double fused = alpha * lex + (1.0 - alpha) * sem;
      results.add(new RankedResult(candidate.documentId(), lex, sem, fused, 0));
    }

    results.sort(RankedResult.TOTAL_ORDER);
    int limit = Math.min(k, results.size());
    List<RankedResult> top = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      top.add(results.get(i).withRank(i + 1));
    }
    log.debug(
        "Ranked {} candidates for '{}' (alpha={}, k={}), kept {}",
        candidates.size(),
        query,
        alpha,
        k,
        top.size());
    return List.copyOf(top);
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}

package com.flamingo.ai.esgmaturity.service.ranking;

import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import java.util.List;

/**
 * Semantic relevance signal fused by {@link HybridRanker}. Implementations may be replaced by a
 * real embedding or cross-encoder model; the ranker only relies on the returned values.
 */
public interface SemanticScorer {

  /**
   * Scores each text against the query.
   *
   * @param query search query
   * @param texts candidate texts, in candidate order
   * @param context source of the seed for reproducible tie-breaks
   * @return one score per text, same order, expected in [0,1]
   */
  double[] score(String query, List<String> texts, DeterminismContext context);
}

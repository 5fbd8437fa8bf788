package com.flamingo.ai.esgmaturity.service.ranking;

import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import com.flamingo.ai.esgmaturity.service.determinism.StableHash;
import com.google.common.annotations.VisibleForTesting;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Placeholder cross-encoder: Jaccard overlap of query and text token sets, plus a micro
 * perturbation below 0.001 derived from {@code stableHash(seed, query, index)} so exact ties break
 * the same way on every run.
 */
@Component
public class TokenOverlapSemanticScorer implements SemanticScorer {

  static final double PERTURBATION_SCALE = 1e-6;
  static final int PERTURBATION_BUCKETS = 1000;

  @Override
  public double[] score(String query, List<String> texts, DeterminismContext context) {
    Set<String> queryTokens = Tokenizer.tokenSet(query);
    double[] scores = new double[texts.size()];
    for (int i = 0; i < texts.size(); i++) {
      double overlap = jaccard(queryTokens, Tokenizer.tokenSet(texts.get(i)));
      scores[i] = Math.min(1.0, overlap + perturbation(context.seed(), query, i));
    }
    return scores;
  }

  @VisibleForTesting
  static double jaccard(Set<String> a, Set<String> b) {
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    if (union.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    return (double) intersection.size() / union.size();
  }

  @VisibleForTesting
  static double perturbation(long seed, String query, int index) {
    long bucket = Math.floorMod(StableHash.asLong(seed, query, index), PERTURBATION_BUCKETS);
    return bucket * PERTURBATION_SCALE;
  }
}

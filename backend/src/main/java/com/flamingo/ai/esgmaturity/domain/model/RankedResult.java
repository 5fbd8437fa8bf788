package com.flamingo.ai.esgmaturity.domain.model;

import java.util.Comparator;

/**
 * One fused ranking entry. All scores are the normalised values that took part in ordering.
 *
 * @param documentId id of the ranked text unit
 * @param lexicalScore normalised lexical score
 * @param semanticScore normalised semantic score
 * @param fusedScore {@code alpha * lexical + (1 - alpha) * semantic}
 * @param rank 1-based position in the ranking
 */
public record RankedResult(
    String documentId, double lexicalScore, double semanticScore, double fusedScore, int rank) {

  /** Fused desc, lexical desc, semantic desc, document id asc. */
  public static final Comparator<RankedResult> TOTAL_ORDER =
      Comparator.comparingDouble(RankedResult::fusedScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(RankedResult::lexicalScore).reversed())
          .thenComparing(Comparator.comparingDouble(RankedResult::semanticScore).reversed())
          .thenComparing(RankedResult::documentId);

  public RankedResult withRank(int newRank) {
    return new RankedResult(documentId, lexicalScore, semanticScore, fusedScore, newRank);
  }
}

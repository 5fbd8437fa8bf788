package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Compiled theme.
 *
 * @param id theme id, e.g. {@code GHG}
 * @param name display name
 * @param query retrieval query used to rank report text for this theme
 * @param minQuotesOverride theme-specific evidence minimum, or null to use the rubric default
 * @param stageZeroLabel descriptor of stage 0, may be null
 * @param stages stage thresholds in ascending stage order
 */
public record RubricTheme(
    String id,
    String name,
    String query,
    Integer minQuotesOverride,
    String stageZeroLabel,
    List<RubricStage> stages) {

  public RubricTheme {
    stages = stages.stream().sorted(Comparator.comparingInt(RubricStage::stage)).toList();
  }

  public int minQuotes(int rubricDefault) {
    return minQuotesOverride != null ? minQuotesOverride : rubricDefault;
  }

  /** True if the text supports any stage of this theme. */
  public boolean matchesAnyStage(String text) {
    return stages.stream().anyMatch(s -> s.matches(text));
  }

  /** Earliest signal of the highest stage the text supports. */
  public Optional<RubricStage.SignalSpan> strongestSignal(String text) {
    for (int i = stages.size() - 1; i >= 0; i--) {
      Optional<RubricStage.SignalSpan> signal = stages.get(i).firstSignal(text);
      if (signal.isPresent()) {
        return signal;
      }
    }
    return Optional.empty();
  }
}

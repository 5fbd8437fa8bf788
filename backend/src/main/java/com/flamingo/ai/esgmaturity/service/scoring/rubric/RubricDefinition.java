package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * JSON form of a versioned maturity rubric, validated before it is compiled into a {@link
 * Rubric}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RubricDefinition(
    @NotBlank String version,
    @Min(1) Integer minQuotes,
    @NotEmpty List<@Valid ThemeDefinition> themes) {

  /** One theme with its ordered stage thresholds. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ThemeDefinition(
      @NotBlank String id,
      @NotBlank String name,
      @NotBlank String query,
      @Min(1) Integer minQuotes,
      String stageZeroLabel,
      @NotEmpty List<@Valid StageDefinition> stages) {}

  /** Signals that qualify evidence for a stage; regex patterns are case-insensitive. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StageDefinition(
      @Min(1) @Max(4) int stage,
      @NotBlank String label,
      List<String> patterns,
      List<String> keywords) {}
}

package com.flamingo.ai.esgmaturity.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a scoring batch. Unset alpha and top-K fall back to configuration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringRunRequest {

  @NotEmpty(message = "At least one unit is required")
  private List<@Valid ScoringUnitRequest> units;

  @DecimalMin(value = "0.0", message = "Alpha must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Alpha must be between 0 and 1")
  private Double alpha;

  @Min(value = 0, message = "Top-K must not be negative")
  @Max(value = 1000, message = "Top-K must be at most 1000")
  private Integer topK;
}

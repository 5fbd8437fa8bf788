package com.flamingo.ai.esgmaturity.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One organisation and year to score; an empty theme list means every rubric theme. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringUnitRequest {

  @NotBlank(message = "Organisation id is required")
  private String orgId;

  private String name;

  private String ticker;

  @NotNull(message = "Year is required")
  @Min(value = 1990, message = "Year must be 1990 or later")
  @Max(value = 2100, message = "Year must be 2100 or earlier")
  private Integer year;

  private List<@NotBlank String> themes;

  /** Overrides the theme queries for this organisation. */
  private String query;
}

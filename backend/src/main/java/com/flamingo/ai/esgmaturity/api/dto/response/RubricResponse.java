package com.flamingo.ai.esgmaturity.api.dto.response;

import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricStage;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing the loaded rubric. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RubricResponse {

  private String version;
  private int minQuotes;
  private List<Theme> themes;

  /** Theme summary. */
  public record Theme(String id, String name, String query, int minQuotes, List<Stage> stages) {}

  /** Stage summary. */
  public record Stage(int stage, String label) {}

  public static RubricResponse from(Rubric rubric) {
    List<Theme> themes = rubric.themes().stream().map(t -> toTheme(rubric, t)).toList();
    return RubricResponse.builder()
        .version(rubric.version())
        .minQuotes(rubric.defaultMinQuotes())
        .themes(themes)
        .build();
  }

  private static Theme toTheme(Rubric rubric, RubricTheme theme) {
    List<Stage> stages = theme.stages().stream().map(RubricResponse::toStage).toList();
    return new Theme(theme.id(), theme.name(), theme.query(), rubric.minQuotesFor(theme), stages);
  }

  private static Stage toStage(RubricStage stage) {
    return new Stage(stage.stage(), stage.label());
  }
}

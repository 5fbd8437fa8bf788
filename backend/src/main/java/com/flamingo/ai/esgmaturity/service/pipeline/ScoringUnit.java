package com.flamingo.ai.esgmaturity.service.pipeline;

import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.util.Comparator;

/**
 * One independent piece of work: score one theme for one organisation and year.
 *
 * @param company organisation
 * @param year fiscal year
 * @param themeId rubric theme id
 * @param query retrieval query, or null to use the theme's query
 */
public record ScoringUnit(CompanyRef company, int year, String themeId, String query) {

  /** Canonical presentation order: org id, year, theme id. */
  public static final Comparator<ScoringUnit> CANONICAL_ORDER =
      Comparator.comparing((ScoringUnit u) -> u.company().id())
          .thenComparingInt(ScoringUnit::year)
          .thenComparing(ScoringUnit::themeId);

  public ScoringUnit {
    if (company == null) {
      throw new InvalidInputException("company is required");
    }
    if (themeId == null || themeId.isBlank()) {
      throw new InvalidInputException("theme is required");
    }
    if (query != null && query.isBlank()) {
      query = null;
    }
  }

  public static ScoringUnit of(CompanyRef company, int year, String themeId) {
    return new ScoringUnit(company, year, themeId, null);
  }
}

package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A loaded, validated rubric. Themes keep their definition order. */
public final class Rubric {

  private final String version;
  private final int defaultMinQuotes;
  private final Map<String, RubricTheme> themes;

  public Rubric(String version, int defaultMinQuotes, List<RubricTheme> themes) {
    this.version = version;
    this.defaultMinQuotes = defaultMinQuotes;
    Map<String, RubricTheme> byId = new LinkedHashMap<>();
    themes.forEach(t -> byId.put(t.id(), t));
    this.themes = Collections.unmodifiableMap(byId);
  }

  public String version() {
    return version;
  }

  public int defaultMinQuotes() {
    return defaultMinQuotes;
  }

  public List<RubricTheme> themes() {
    return List.copyOf(themes.values());
  }

  public Optional<RubricTheme> theme(String id) {
    return Optional.ofNullable(themes.get(id));
  }

  public RubricTheme requireTheme(String id) {
    return theme(id).orElseThrow(() -> new InvalidInputException("Unknown rubric theme: " + id));
  }

  public int minQuotesFor(RubricTheme theme) {
    return theme.minQuotes(defaultMinQuotes);
  }
}

package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled stage threshold. A text supports the stage when any pattern or keyword matches it.
 *
 * @param stage stage number 1..4
 * @param label human-readable descriptor
 * @param patterns case-insensitive regexes
 * @param keywords lowercase literal phrases
 */
public record RubricStage(int stage, String label, List<Pattern> patterns, List<String> keywords) {

  public RubricStage {
    patterns = List.copyOf(patterns);
    keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
  }

  public boolean matches(String text) {
    return !matchedSignals(text).isEmpty();
  }

  /** Sources of the patterns and keywords found in {@code text}, sorted. */
  public Set<String> matchedSignals(String text) {
    Set<String> matched = new TreeSet<>();
    if (text == null || text.isEmpty()) {
      return matched;
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        matched.add(pattern.pattern());
      }
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        matched.add("kw:" + keyword);
      }
    }
    return matched;
  }

  /** Earliest pattern or keyword occurrence in {@code text}, if any. */
  public Optional<SignalSpan> firstSignal(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    SignalSpan first = null;
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find() && (first == null || matcher.start() < first.start())) {
        first = new SignalSpan(matcher.start(), matcher.end());
      }
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      int at = lower.indexOf(keyword);
      if (at >= 0 && (first == null || at < first.start())) {
        first = new SignalSpan(at, Math.min(text.length(), at + keyword.length()));
      }
    }
    return Optional.ofNullable(first);
  }

  public int signalCount() {
    return patterns.size() + keywords.size();
  }

  /** Character range of a matched signal, end exclusive. */
  public record SignalSpan(int start, int end) {}
}

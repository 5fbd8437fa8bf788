package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Reads and validates a rubric definition. Any problem is a {@link ConfigException}: the scorer
 * cannot run without a valid rubric.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RubricLoader {

  private static final ObjectMapper STRICT_MAPPER =
      JsonMapper.builder()
          .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
          .build();

  private final Validator validator;

  /**
   * Loads a rubric from a Spring resource.
   *
   * @param resource rubric JSON
   * @param fallbackMinQuotes evidence minimum used when the rubric does not declare one
   */
  public Rubric load(Resource resource, int fallbackMinQuotes) {
    if (resource == null || !resource.exists()) {
      throw new ConfigException("Rubric definition not found: " + resource);
    }
    try (InputStream in = resource.getInputStream()) {
      Rubric rubric = parse(in, fallbackMinQuotes);
      log.info(
          "Loaded rubric v{} from {} with {} themes",
          rubric.version(),
          resource.getDescription(),
          rubric.themes().size());
      return rubric;
    } catch (IOException e) {
      throw new ConfigException("Failed to read rubric " + resource.getDescription(), e);
    }
  }

  public Rubric parse(InputStream in, int fallbackMinQuotes) throws IOException {
    RubricDefinition definition;
    try {
      definition = STRICT_MAPPER.readValue(in, RubricDefinition.class);
    } catch (JsonProcessingException e) {
      throw new ConfigException("Rubric is not valid JSON: " + e.getOriginalMessage(), e);
    }
    return compile(definition, fallbackMinQuotes);
  }

  @VisibleForTesting
  Rubric compile(RubricDefinition definition, int fallbackMinQuotes) {
    if (definition == null) {
      throw new ConfigException("Rubric definition is empty");
    }
    Set<ConstraintViolation<RubricDefinition>> violations = validator.validate(definition);
    if (!violations.isEmpty()) {
      String details =
          violations.stream()
              .map(v -> v.getPropertyPath() + " " + v.getMessage())
              .collect(Collectors.toCollection(TreeSet::new))
              .toString();
      throw new ConfigException("Rubric failed validation: " + details);
    }
    if (fallbackMinQuotes < 1) {
      throw new ConfigException("scoring.rubric.min-quotes must be >= 1");
    }

    Set<String> themeIds = new HashSet<>();
    List<RubricTheme> themes = new ArrayList<>();
    for (RubricDefinition.ThemeDefinition theme : definition.themes()) {
      if (!themeIds.add(theme.id())) {
        throw new ConfigException("Duplicate rubric theme: " + theme.id());
      }
      themes.add(compileTheme(theme));
    }
    int minQuotes = definition.minQuotes() != null ? definition.minQuotes() : fallbackMinQuotes;
    return new Rubric(definition.version(), minQuotes, themes);
  }

  private RubricTheme compileTheme(RubricDefinition.ThemeDefinition theme) {
    Set<Integer> stageNumbers = new HashSet<>();
    List<RubricStage> stages = new ArrayList<>();
    for (RubricDefinition.StageDefinition stage : theme.stages()) {
      if (!stageNumbers.add(stage.stage())) {
        throw new ConfigException(
            "Theme " + theme.id() + " defines stage " + stage.stage() + " twice");
      }
      List<String> patterns = stage.patterns() == null ? List.of() : stage.patterns();
      List<String> keywords = stage.keywords() == null ? List.of() : stage.keywords();
      if (patterns.isEmpty() && keywords.isEmpty()) {
        throw new ConfigException(
            "Theme " + theme.id() + " stage " + stage.stage() + " has no patterns or keywords");
      }
      List<Pattern> compiled = new ArrayList<>();
      for (String pattern : patterns) {
        compiled.add(compilePattern(theme.id(), stage.stage(), pattern));
      }
      for (String keyword : keywords) {
        if (keyword == null || keyword.isBlank()) {
          throw new ConfigException(
              "Theme " + theme.id() + " stage " + stage.stage() + " has a blank keyword");
        }
      }
      stages.add(new RubricStage(stage.stage(), stage.label(), compiled, keywords));
    }
    return new RubricTheme(
        theme.id(), theme.name(), theme.query(), theme.minQuotes(), theme.stageZeroLabel(), stages);
  }

  private static Pattern compilePattern(String themeId, int stage, String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new ConfigException("Theme " + themeId + " stage " + stage + " has a blank pattern");
    }
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    } catch (PatternSyntaxException e) {
      throw new ConfigException(
          "Theme " + themeId + " stage " + stage + " has an invalid pattern: " + pattern, e);
    }
  }
}

package com.flamingo.ai.esgmaturity.config;

import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricLoader;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Loads the rubric at startup; a missing or invalid rubric stops the application. */
@Configuration
@RequiredArgsConstructor
public class RubricConfig {

  private final ScoringConfig scoringConfig;

  @Bean
  public Rubric rubric(RubricLoader rubricLoader, ResourceLoader resourceLoader) {
    ScoringConfig.Rubric config = scoringConfig.getRubric();
    return rubricLoader.load(
        resourceLoader.getResource(config.getLocation()), config.getMinQuotes());
  }
}

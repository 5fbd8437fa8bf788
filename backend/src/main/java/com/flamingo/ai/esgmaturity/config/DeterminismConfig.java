package com.flamingo.ai.esgmaturity.config;

import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Establishes the process-wide determinism context once at startup. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DeterminismConfig {

  private final ScoringConfig scoringConfig;

  /** Fails startup with a ConfigException when determinism is enabled but incomplete. */
  @Bean
  public DeterminismContext determinismContext() {
    DeterminismContext context = DeterminismContext.fromConfig(scoringConfig.getDeterminism());
    log.info("Determinism context established: {}", context);
    return context;
  }
}

package com.flamingo.ai.esgmaturity.api.rest;

import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import com.flamingo.ai.esgmaturity.service.resolver.ProviderRegistry;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and engine info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final DeterminismContext determinismContext;
  private final Rubric rubric;
  private final ProviderRegistry providerRegistry;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", determinismContext.now());
    health.put("service", "esg-maturity");
    health.put("deterministic", determinismContext.isDeterministic());
    health.put("rubricVersion", rubric.version());
    health.put("providers", providerRegistry.size());
    return ResponseEntity.ok(health);
  }
}

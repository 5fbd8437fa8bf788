package com.flamingo.ai.esgmaturity.service.determinism;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SnapshotIdGeneratorTest {

  @Test
  @DisplayName("should not depend on map insertion order")
  void shouldIgnoreInsertionOrder() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("alpha", 0.5);
    first.put("top_k", 5);
    first.put("units", List.of(Map.of("org", "ACME", "year", 2024)));
    Map<String, Object> second = new LinkedHashMap<>();
    second.put("units", List.of(Map.of("year", 2024, "org", "ACME")));
    second.put("top_k", 5);
    second.put("alpha", 0.5);

    assertThat(SnapshotIdGenerator.generate(first))
        .isEqualTo(SnapshotIdGenerator.generate(second))
        .matches("snap-[0-9a-f]{16}");
  }

  @Test
  @DisplayName("should change when any parameter changes")
  void shouldChangeWithParameters() {
    assertThat(SnapshotIdGenerator.generate(Map.of("alpha", 0.5)))
        .isNotEqualTo(SnapshotIdGenerator.generate(Map.of("alpha", 0.6)));
  }
}

package com.flamingo.ai.esgmaturity.service.determinism;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives a run identifier from the canonical JSON form of the run parameters, so two runs over
 * the same inputs can be compared by id alone.
 */
public final class SnapshotIdGenerator {

  private static final ObjectMapper CANONICAL =
      JsonMapper.builder()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .findAndAddModules()
          .build();

  private SnapshotIdGenerator() {}

  public static String generate(Map<String, ?> parameters) {
    Map<String, Object> withVersion = new TreeMap<>(parameters);
    withVersion.put("hash_version", StableHash.VERSION);
    try {
      byte[] canonical = CANONICAL.writeValueAsString(withVersion).getBytes(StandardCharsets.UTF_8);
      return "snap-" + StableHash.hex(canonical).substring(0, 16);
    } catch (JsonProcessingException e) {
      throw new InvalidInputException(
          "Snapshot parameters are not serializable: " + e.getMessage());
    }
  }
}

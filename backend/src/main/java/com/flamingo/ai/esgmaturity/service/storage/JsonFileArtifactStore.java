package com.flamingo.ai.esgmaturity.service.storage;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.exception.ArtifactException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes artifacts as pretty-printed JSON with a fixed key order under {@code
 * <output-dir>/<snapshot-id>/scores/} and {@code .../parity/}. Identical inputs produce identical
 * files.
 */
@Component
@Slf4j
public class JsonFileArtifactStore implements ArtifactStore {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private final Path outputDir;

  @Autowired
  public JsonFileArtifactStore(ScoringConfig scoringConfig) {
    this(Path.of(scoringConfig.getArtifacts().getOutputDir()));
  }

  public JsonFileArtifactStore(Path outputDir) {
    this.outputDir = outputDir;
  }

  @Override
  public Path writeScore(StageScore score) {
    Path target =
        outputDir
            .resolve(safe(score.snapshotId()))
            .resolve("scores")
            .resolve(fileName(score.orgId(), score.year(), score.theme()));
    return write(target, score);
  }

  @Override
  public Path writeParity(
      String snapshotId, String orgId, int year, String theme, ParityReport report) {
    Path target =
        outputDir
            .resolve(safe(snapshotId))
            .resolve("parity")
            .resolve(fileName(orgId, year, theme));
    return write(target, report);
  }

  private Path write(Path target, Object artifact) {
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, MAPPER.writeValueAsBytes(artifact));
      log.debug("Wrote artifact {}", target);
      return target;
    } catch (IOException e) {
      throw new ArtifactException("Failed to write " + target + ": " + e.getMessage(), e);
    }
  }

  private static String fileName(String orgId, int year, String theme) {
    return safe(orgId) + "_" + year + "_" + safe(theme) + ".json";
  }

  @VisibleForTesting
  static String safe(String part) {
    return part.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}

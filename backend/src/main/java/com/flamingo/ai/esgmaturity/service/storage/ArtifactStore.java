package com.flamingo.ai.esgmaturity.service.storage;

import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import java.nio.file.Path;

/** Write side of the storage layer for run outputs. Artifacts are immutable once written. */
public interface ArtifactStore {

  Path writeScore(StageScore score);

  Path writeParity(String snapshotId, String orgId, int year, String theme, ParityReport report);
}

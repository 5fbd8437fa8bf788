package com.flamingo.ai.esgmaturity.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A report that was downloaded or found locally. Owned by one pipeline unit and dropped after text
 * extraction.
 *
 * @param source the candidate it was obtained from
 * @param contentPath local handle to the bytes
 * @param contentHash SHA-256 hex of the bytes
 * @param byteLength size of the content
 * @param priorFailures downloads that failed before this one succeeded, in attempt order
 */
public record ResolvedDocument(
    SourceCandidate source,
    Path contentPath,
    String contentHash,
    long byteLength,
    List<ResolutionAttempt> priorFailures) {

  public ResolvedDocument {
    priorFailures = priorFailures == null ? List.of() : List.copyOf(priorFailures);
  }

  public ResolvedDocument(
      SourceCandidate source, Path contentPath, String contentHash, long byteLength) {
    this(source, contentPath, contentHash, byteLength, List.of());
  }

  public ResolvedDocument withPriorFailures(List<ResolutionAttempt> failures) {
    return new ResolvedDocument(source, contentPath, contentHash, byteLength, failures);
  }
}

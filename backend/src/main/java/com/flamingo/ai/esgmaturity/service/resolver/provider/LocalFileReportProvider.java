package com.flamingo.ai.esgmaturity.service.resolver.provider;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.enums.AccessMethod;
import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.SourceCandidate;
import com.flamingo.ai.esgmaturity.exception.ProviderException;
import com.flamingo.ai.esgmaturity.service.determinism.StableHash;
import com.flamingo.ai.esgmaturity.service.resolver.ReportProvider;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves reports from a directory laid out as {@code <root>/<orgId>/<year>/}. Every regular file in
 * the year directory is one candidate, in file-name order.
 */
@Slf4j
public class LocalFileReportProvider implements ReportProvider {

  private final String id;
  private final int tier;
  private final int priority;
  private final boolean enabled;
  private final Path root;
  private final String defaultContentType;

  public LocalFileReportProvider(ScoringConfig.Provider config) {
    this.id = config.getId();
    this.tier = config.getTier();
    this.priority = config.getPriority();
    this.enabled = config.isEnabled();
    this.root = Path.of(config.getRootDir()).toAbsolutePath().normalize();
    this.defaultContentType = config.getContentType();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public int tier() {
    return tier;
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public List<SourceCandidate> search(CompanyRef company, int year, int queriedTier) {
    Path yearDir = root.resolve(company.id()).resolve(String.valueOf(year)).normalize();
    if (!yearDir.startsWith(root) || !Files.isDirectory(yearDir)) {
      log.debug("No report directory for {} ({}) under {}", company.id(), year, root);
      return List.of();
    }
    try (Stream<Path> files = Files.list(yearDir)) {
      return files
          .filter(Files::isRegularFile)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .map(file -> toCandidate(file, queriedTier))
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new ProviderException(id, "Failed to list " + yearDir + ": " + e.getMessage(), e);
    }
  }

  @Override
  public ResolvedDocument download(SourceCandidate candidate) {
    if (candidate.url() == null) {
      throw new ProviderException(id, "Candidate has no file location");
    }
    Path file;
    try {
      file = Path.of(URI.create(candidate.url())).toAbsolutePath().normalize();
    } catch (IllegalArgumentException e) {
      throw new ProviderException(id, "Invalid file location: " + candidate.url(), e);
    }
    if (!file.startsWith(root)) {
      throw new ProviderException(id, "File is outside the provider root: " + file);
    }
    try {
      byte[] content = Files.readAllBytes(file);
      if (content.length == 0) {
        throw new ProviderException(id, "File is empty: " + file.getFileName());
      }
      return new ResolvedDocument(candidate, file, StableHash.hex(content), content.length);
    } catch (IOException e) {
      throw new ProviderException(id, "Failed to read " + file + ": " + e.getMessage(), e);
    }
  }

  private SourceCandidate toCandidate(Path file, int queriedTier) {
    return SourceCandidate.builder()
        .providerId(id)
        .tier(queriedTier)
        .priorityScore(priority)
        .access(AccessMethod.FILE)
        .contentType(
            ContentTypes.forFileName(file.getFileName().toString(), defaultContentType))
        .url(file.toUri().toString())
        .build();
  }
}

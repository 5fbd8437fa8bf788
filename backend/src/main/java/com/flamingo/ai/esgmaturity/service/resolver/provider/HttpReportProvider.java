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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * Fetches reports from a URL template such as {@code https://host/reports/{ticker}/{year}.txt}.
 * Search is offline: it only expands the template. The network is touched on download.
 */
@Slf4j
public class HttpReportProvider implements ReportProvider {

  private static final int MAX_REPORT_BYTES = 32 * 1024 * 1024;

  private final String id;
  private final int tier;
  private final int priority;
  private final boolean enabled;
  private final String urlTemplate;
  private final String contentType;
  private final Path downloadDir;
  private final Duration timeout;
  private final WebClient webClient;

  public HttpReportProvider(
      ScoringConfig.Provider config, ScoringConfig.Resolver resolver, WebClient webClient) {
    this.id = config.getId();
    this.tier = config.getTier();
    this.priority = config.getPriority();
    this.enabled = config.isEnabled();
    this.urlTemplate = config.getUrlTemplate();
    this.contentType = config.getContentType();
    this.downloadDir = Path.of(resolver.getDownloadDir());
    this.timeout = Duration.ofMillis(resolver.getProviderTimeoutMs());
    this.webClient = webClient;
  }

  public HttpReportProvider(ScoringConfig.Provider config, ScoringConfig.Resolver resolver) {
    this(
        config,
        resolver,
        WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_REPORT_BYTES))
            .build());
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
    if (urlTemplate.contains("{ticker}") && company.ticker() == null) {
      log.debug("Provider {} needs a ticker, {} has none", id, company.id());
      return List.of();
    }
    String url =
        urlTemplate
            .replace("{org}", company.id())
            .replace("{ticker}", company.ticker() == null ? "" : company.ticker())
            .replace("{year}", String.valueOf(year));
    return List.of(
        SourceCandidate.builder()
            .providerId(id)
            .tier(queriedTier)
            .priorityScore(priority)
            .access(AccessMethod.API)
            .contentType(contentType)
            .url(url)
            .build());
  }

  @Override
  public ResolvedDocument download(SourceCandidate candidate) {
    byte[] content;
    try {
      content =
          webClient
              .get()
              .uri(candidate.url())
              .retrieve()
              .bodyToMono(byte[].class)
              .timeout(timeout)
              .block();
    } catch (WebClientException e) {
      throw new ProviderException(id, "GET " + candidate.url() + " failed: " + e.getMessage(), e);
    }
    if (content == null || content.length == 0) {
      throw new ProviderException(id, "GET " + candidate.url() + " returned no content");
    }

    String hash = StableHash.hex(content);
    Path target = downloadDir.resolve(hash + "." + ContentTypes.extensionFor(contentType));
    try {
      Files.createDirectories(downloadDir);
      Files.write(target, content);
    } catch (IOException e) {
      throw new ProviderException(id, "Failed to store download: " + e.getMessage(), e);
    }
    log.info("Downloaded {} bytes from {} to {}", content.length, candidate.url(), target);
    return new ResolvedDocument(candidate, target, hash, content.length);
  }
}

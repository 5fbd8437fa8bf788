package com.flamingo.ai.esgmaturity.config;

import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.service.resolver.ProviderRegistry;
import com.flamingo.ai.esgmaturity.service.resolver.ReportProvider;
import com.flamingo.ai.esgmaturity.service.resolver.provider.HttpReportProvider;
import com.flamingo.ai.esgmaturity.service.resolver.provider.LocalFileReportProvider;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the provider registry from {@code scoring.providers}. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ProviderConfig {

  private final ScoringConfig scoringConfig;

  @Bean
  public ProviderRegistry providerRegistry() {
    List<ReportProvider> providers = new ArrayList<>();
    for (ScoringConfig.Provider provider : scoringConfig.getProviders()) {
      providers.add(create(provider));
    }
    ProviderRegistry registry = new ProviderRegistry(providers);
    log.info(
        "Registered {} report providers across tiers {}",
        registry.size(),
        registry.tiers().keySet());
    return registry;
  }

  private ReportProvider create(ScoringConfig.Provider provider) {
    if (provider.getId() == null || provider.getId().isBlank()) {
      throw new ConfigException("scoring.providers[].id is required");
    }
    if (provider.getType() == null) {
      throw new ConfigException("Provider " + provider.getId() + " has no type");
    }
    if (provider.getPriority() < 0 || provider.getPriority() > 100) {
      throw new ConfigException(
          "Provider "
              + provider.getId()
              + " has priority outside [0,100]: "
              + provider.getPriority());
    }
    return switch (provider.getType()) {
      case LOCAL_FILE -> {
        if (provider.getRootDir() == null || provider.getRootDir().isBlank()) {
          throw new ConfigException("Provider " + provider.getId() + " needs root-dir");
        }
        yield new LocalFileReportProvider(provider);
      }
      case HTTP_REPORT -> {
        if (provider.getUrlTemplate() == null || provider.getUrlTemplate().isBlank()) {
          throw new ConfigException("Provider " + provider.getId() + " needs url-template");
        }
        yield new HttpReportProvider(provider, scoringConfig.getResolver());
      }
    };
  }
}

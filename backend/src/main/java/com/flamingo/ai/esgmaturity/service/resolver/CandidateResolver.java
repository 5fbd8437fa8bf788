package com.flamingo.ai.esgmaturity.service.resolver;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.enums.ResolutionState;
import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.domain.model.ResolutionAttempt;
import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.SourceCandidate;
import com.flamingo.ai.esgmaturity.exception.ProviderException;
import com.flamingo.ai.esgmaturity.exception.ResolutionFailedException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Finds the best available report for an organisation across tiered providers.
 *
 * <p>Resolution runs {@code SEARCHING -> PRIORITIZING -> DOWNLOADING(i) -> RESOLVED | EXHAUSTED}.
 * Search is fail-open per provider: a provider that throws or times out contributes no candidates.
 * Download is fail-closed overall: every candidate is tried in priority order and the first success
 * wins, otherwise {@link ResolutionFailedException} is raised.
 *
 * <p>Each provider call runs on the provider executor under a time limiter. A call that overruns
 * its timeout is cancelled with an interrupt; a provider that ignores interrupts keeps its thread
 * until it returns, but its result is discarded.
 */
@Service
@Slf4j
public class CandidateResolver {

  /** Tier ascending, then priority ascending. */
  public static final Comparator<SourceCandidate> PRIORITY_ORDER =
      Comparator.comparingInt(SourceCandidate::tier)
          .thenComparingInt(SourceCandidate::priorityScore);

  private final ProviderRegistry providerRegistry;
  private final MeterRegistry meterRegistry;
  private final AsyncTaskExecutor providerCallExecutor;
  private final TimeLimiter timeLimiter;
  private final long timeoutMs;

  public CandidateResolver(
      ProviderRegistry providerRegistry,
      ScoringConfig scoringConfig,
      MeterRegistry meterRegistry,
      TimeLimiterRegistry timeLimiterRegistry,
      @Qualifier("providerCallExecutor") AsyncTaskExecutor providerCallExecutor) {
    this.providerRegistry = providerRegistry;
    this.meterRegistry = meterRegistry;
    this.providerCallExecutor = providerCallExecutor;
    this.timeoutMs = scoringConfig.getResolver().getProviderTimeoutMs();
    this.timeLimiter =
        timeLimiterRegistry.timeLimiter(
            "report-provider",
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
  }

  /**
   * Queries every enabled provider in every tier and concatenates their candidates in tier and
   * registration order. An empty result means nothing was found and is not an error.
   */
  @Timed(value = "scoring.resolver.search", description = "Time to search all providers")
  public List<SourceCandidate> search(CompanyRef company, int year) {
    List<SourceCandidate> all = new ArrayList<>();
    log.info(
        "Searching reports for {} ({}) across {} tiers",
        company.id(),
        year,
        providerRegistry.tiers().size());

    for (Map.Entry<Integer, List<ReportProvider>> tier : providerRegistry.tiers().entrySet()) {
      int tierNumber = tier.getKey();
      for (ReportProvider provider : tier.getValue()) {
        if (!provider.isEnabled()) {
          log.info("Skipping disabled provider {}", provider.id());
          continue;
        }
        try {
          List<SourceCandidate> found =
              callWithTimeout(
                  provider, "search", () -> provider.search(company, year, tierNumber));
          int accepted = 0;
          for (SourceCandidate candidate : found == null ? List.<SourceCandidate>of() : found) {
            if (candidate == null) {
              log.warn("Provider {} returned a null candidate, skipping", provider.id());
              continue;
            }
            all.add(candidate);
            accepted++;
          }
          log.info(
              "Provider {} (tier {}) found {} candidates", provider.id(), tierNumber, accepted);
        } catch (RuntimeException e) {
          meterRegistry.counter("scoring.resolver.provider.failures").increment();
          log.warn(
              "Provider {} search failed, continuing with remaining providers: {}",
              provider.id(),
              e.getMessage());
        }
      }
    }

    log.info("Total candidates for {} ({}): {}", company.id(), year, all.size());
    return all;
  }

  /** Stable sort by {@link #PRIORITY_ORDER}; idempotent. */
  public List<SourceCandidate> prioritize(List<SourceCandidate> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    List<SourceCandidate> sorted = new ArrayList<>(candidates);
    sorted.sort(PRIORITY_ORDER);
    if (log.isDebugEnabled()) {
      for (int i = 0; i < Math.min(5, sorted.size()); i++) {
        SourceCandidate c = sorted.get(i);
        log.debug(
            "  {}. {} (tier={}, priority={})", i + 1, c.providerId(), c.tier(), c.priorityScore());
      }
    }
    return List.copyOf(sorted);
  }

  /**
   * Searches, prioritizes and downloads the first candidate that succeeds.
   *
   * @return the resolved document with the failed attempts that preceded it
   * @throws ResolutionFailedException if there are no candidates or every download fails
   */
  @Timed(value = "scoring.resolver.resolve", description = "Time to resolve the best report")
  public ResolvedDocument resolveBest(CompanyRef company, int year) {
    ResolutionState state = ResolutionState.SEARCHING;
    List<SourceCandidate> candidates = search(company, year);

    state = transition(company, state, ResolutionState.PRIORITIZING);
    List<SourceCandidate> ordered = prioritize(candidates);

    List<ResolutionAttempt> failures = new ArrayList<>();
    RuntimeException lastError = null;

    for (int i = 0; i < ordered.size(); i++) {
      SourceCandidate candidate = ordered.get(i);
      state = transition(company, state, ResolutionState.DOWNLOADING);
      log.info(
          "Attempting download (rank {}/{}): {} (tier={}, priority={})",
          i + 1,
          ordered.size(),
          candidate.providerId(),
          candidate.tier(),
          candidate.priorityScore());
      try {
        ResolvedDocument document = download(candidate);
        transition(company, state, ResolutionState.RESOLVED);
        meterRegistry.counter("scoring.resolver.resolved").increment();
        log.info(
            "Resolved report for {} ({}) from {} after {} failed attempts",
            company.id(),
            year,
            candidate.providerId(),
            failures.size());
        return document.withPriorFailures(failures);
      } catch (RuntimeException e) {
        lastError = e;
        failures.add(ResolutionAttempt.failed(i + 1, candidate, e));
        meterRegistry.counter("scoring.resolver.download.failures").increment();
        log.warn(
            "Download failed from {} (rank {}): {}. Trying next candidate",
            candidate.providerId(),
            i + 1,
            e.getMessage());
      }
    }

    transition(company, state, ResolutionState.EXHAUSTED);
    throw new ResolutionFailedException(company.id(), year, failures, lastError);
  }

  private ResolvedDocument download(SourceCandidate candidate) {
    ReportProvider provider =
        providerRegistry
            .find(candidate.providerId())
            .orElseThrow(
                () ->
                    new ProviderException(
                        candidate.providerId(), "Provider is not registered for download"));
    ResolvedDocument document =
        callWithTimeout(provider, "download", () -> provider.download(candidate));
    if (document == null) {
      throw new ProviderException(provider.id(), "Download returned no document");
    }
    return document;
  }

  private <T> T callWithTimeout(ReportProvider provider, String operation, Supplier<T> call) {
    Callable<T> task = call::get;
    try {
      return timeLimiter.executeFutureSupplier(() -> providerCallExecutor.submit(task));
    } catch (TimeoutException e) {
      throw new ProviderException(
          provider.id(), operation + " timed out after " + timeoutMs + "ms", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(provider.id(), operation + " interrupted", e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ProviderException(provider.id(), operation + " failed: " + e.getMessage(), e);
    }
  }

  private ResolutionState transition(CompanyRef company, ResolutionState from, ResolutionState to) {
    log.debug("Resolution {} -> {} for {}", from, to, company.id());
    return to;
  }
}

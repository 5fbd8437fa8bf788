package com.flamingo.ai.esgmaturity.service.determinism;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Random;

/**
 * Immutable source of time and randomness for one process. Built once at startup and handed to
 * every component entry point; never mutated during a run.
 *
 * <p>In deterministic mode the clock is frozen at the configured instant and every random stream
 * derives from the configured seed, so identical inputs give byte-identical outputs.
 */
public final class DeterminismContext {

  private final boolean deterministic;
  private final Clock clock;
  private final long seed;

  private DeterminismContext(boolean deterministic, Clock clock, long seed) {
    this.deterministic = deterministic;
    this.clock = clock;
    this.seed = seed;
  }

  /** Frozen clock at {@code fixedTime}, all randomness derived from {@code seed}. */
  public static DeterminismContext fixed(Instant fixedTime, long seed) {
    return new DeterminismContext(true, Clock.fixed(fixedTime, ZoneOffset.UTC), seed);
  }

  /** Wall-clock time. Tie-break perturbations still derive from {@code seed}. */
  public static DeterminismContext live(long seed) {
    return new DeterminismContext(false, Clock.systemUTC(), seed);
  }

  /**
   * Builds the context from configuration, failing closed when determinism is requested without a
   * fixed time or seed.
   *
   * @throws ConfigException if determinism is enabled but incompletely configured
   */
  public static DeterminismContext fromConfig(ScoringConfig.Determinism config) {
    if (!config.isEnabled()) {
      return live(config.getSeed() != null ? config.getSeed() : 0L);
    }
    if (config.getFixedTime() == null || config.getFixedTime().isBlank()) {
      throw new ConfigException(
          "Determinism mode is enabled but scoring.determinism.fixed-time is not set");
    }
    if (config.getSeed() == null) {
      throw new ConfigException(
          "Determinism mode is enabled but scoring.determinism.seed is not set");
    }
    Instant fixedTime;
    try {
      fixedTime = Instant.parse(config.getFixedTime().trim());
    } catch (DateTimeParseException e) {
      throw new ConfigException(
          "scoring.determinism.fixed-time is not an ISO-8601 instant: " + config.getFixedTime(), e);
    }
    return fixed(fixedTime, config.getSeed());
  }

  public boolean isDeterministic() {
    return deterministic;
  }

  public long seed() {
    return seed;
  }

  public Instant now() {
    return clock.instant();
  }

  public LocalDate today() {
    return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
  }

  /** Seconds since the epoch with millisecond precision. */
  public double clockSeconds() {
    return clock.millis() / 1000.0;
  }

  /** PRNG whose sequence depends only on {@code streamSeed}. */
  public Random seededRng(long streamSeed) {
    return new Random(streamSeed);
  }

  /** PRNG seeded from this context. */
  public Random rng() {
    return seededRng(seed);
  }

  @Override
  public String toString() {
    return deterministic
        ? "DeterminismContext[fixed " + clock.instant() + ", seed=" + seed + "]"
        : "DeterminismContext[live, seed=" + seed + "]";
  }
}

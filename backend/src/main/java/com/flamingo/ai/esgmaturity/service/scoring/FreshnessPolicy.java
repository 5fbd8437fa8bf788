package com.flamingo.ai.esgmaturity.service.scoring;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Graduated confidence penalty by evidence age. Evidence up to the first bracket's months is
 * penalised by that bracket's penalty, and so on; anything older gets the beyond penalty. Evidence
 * with no known date is treated as fresh.
 */
@Component
public class FreshnessPolicy {

  private final List<ScoringConfig.Bracket> brackets;
  private final double beyondPenalty;

  @Autowired
  public FreshnessPolicy(ScoringConfig scoringConfig) {
    this(scoringConfig.getFreshness());
  }

  public FreshnessPolicy(ScoringConfig.Freshness freshness) {
    this.brackets = List.copyOf(freshness.getBrackets());
    this.beyondPenalty = freshness.getBeyondPenalty();
    int previousMonths = -1;
    for (ScoringConfig.Bracket bracket : brackets) {
      if (bracket.getMonths() <= previousMonths) {
        throw new ConfigException("scoring.freshness.brackets must have increasing months");
      }
      checkPenalty(bracket.getPenalty());
      previousMonths = bracket.getMonths();
    }
    checkPenalty(beyondPenalty);
  }

  /** Policy with the stock 24/36/48 month brackets. */
  public static FreshnessPolicy defaults() {
    return new FreshnessPolicy(new ScoringConfig.Freshness());
  }

  public double penalty(LocalDate publishedOn, LocalDate today) {
    if (publishedOn == null) {
      return 0.0;
    }
    long months = Math.max(0, ChronoUnit.MONTHS.between(publishedOn, today));
    for (ScoringConfig.Bracket bracket : brackets) {
      if (months <= bracket.getMonths()) {
        return bracket.getPenalty();
      }
    }
    return beyondPenalty;
  }

  private static void checkPenalty(double penalty) {
    if (!(penalty >= 0.0 && penalty <= 1.0)) {
      throw new ConfigException("Freshness penalty must be in [0,1], got " + penalty);
    }
  }
}

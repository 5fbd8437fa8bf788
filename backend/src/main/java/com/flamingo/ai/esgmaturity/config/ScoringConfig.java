package com.flamingo.ai.esgmaturity.config;

import com.flamingo.ai.esgmaturity.domain.enums.ProviderType;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval and scoring engine. */
@Configuration
@ConfigurationProperties(prefix = "scoring")
@Getter
@Setter
public class ScoringConfig {

  private Determinism determinism = new Determinism();
  private Retrieval retrieval = new Retrieval();
  private Resolver resolver = new Resolver();
  private List<Provider> providers = new ArrayList<>();
  private Rubric rubric = new Rubric();
  private Freshness freshness = new Freshness();
  private Artifacts artifacts = new Artifacts();

  @Getter
  @Setter
  public static class Determinism {
    /** When true, time and randomness come only from {@code fixedTime} and {@code seed}. */
    private boolean enabled = true;

    /** ISO-8601 instant, e.g. {@code 2025-10-22T03:21:40Z}. */
    private String fixedTime;

    private Long seed;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Weight of the lexical score in the fused score. */
    private double alpha = 0.5;

    private int topK = 5;
    private int maxQuotesPerTheme = 10;
    private int quoteMaxWords = 30;
  }

  @Getter
  @Setter
  public static class Resolver {
    /** Upper bound for a single provider search or download call. */
    private long providerTimeoutMs = 10_000;

    /** Directory where remotely fetched reports are written. */
    private String downloadDir = "data/downloads";
  }

  /** One registered report provider. */
  @Getter
  @Setter
  public static class Provider {
    private String id;
    private ProviderType type;
    private int tier = 3;
    private int priority = 100;
    private boolean enabled = true;

    /** Root directory for {@link ProviderType#LOCAL_FILE}. */
    private String rootDir;

    /** URL template for {@link ProviderType#HTTP_REPORT}; supports {org}, {ticker}, {year}. */
    private String urlTemplate;

    private String contentType = "text/plain";
  }

  @Getter
  @Setter
  public static class Rubric {
    private String location = "classpath:rubric/esg_maturity_rubric_v3.json";

    /** Default minimum of distinct quotes for any stage above 0. */
    private int minQuotes = 2;
  }

  @Getter
  @Setter
  public static class Freshness {
    private List<Bracket> brackets = defaultBrackets();

    /** Penalty for evidence older than the last bracket. */
    private double beyondPenalty = 0.3;

    private static List<Bracket> defaultBrackets() {
      List<Bracket> brackets = new ArrayList<>();
      brackets.add(new Bracket(24, 0.0));
      brackets.add(new Bracket(36, 0.1));
      brackets.add(new Bracket(48, 0.2));
      return brackets;
    }
  }

  /** Evidence up to {@code months} old is penalised by {@code penalty}. */
  @Getter
  @Setter
  public static class Bracket {
    private int months;
    private double penalty;

    public Bracket() {}

    public Bracket(int months, double penalty) {
      this.months = months;
      this.penalty = penalty;
    }
  }

  @Getter
  @Setter
  public static class Artifacts {
    private boolean enabled = true;
    private String outputDir = "data/artifacts";
  }
}

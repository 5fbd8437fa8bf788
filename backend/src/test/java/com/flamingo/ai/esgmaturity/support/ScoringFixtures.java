package com.flamingo.ai.esgmaturity.support;

import com.flamingo.ai.esgmaturity.domain.model.EvidenceQuote;
import com.flamingo.ai.esgmaturity.service.determinism.DeterminismContext;
import com.flamingo.ai.esgmaturity.service.determinism.StableHash;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricLoader;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.core.io.ClassPathResource;

/** Shared test data for scoring tests. */
public final class ScoringFixtures {

  public static final Instant FIXED_TIME = Instant.parse("2025-10-22T03:21:40Z");
  public static final long SEED = 42L;

  private ScoringFixtures() {}

  public static DeterminismContext fixedContext() {
    return DeterminismContext.fixed(FIXED_TIME, SEED);
  }

  public static Validator validator() {
    return Validation.buildDefaultValidatorFactory().getValidator();
  }

  public static RubricLoader rubricLoader() {
    return new RubricLoader(validator());
  }

  /** The rubric shipped with the application. */
  public static Rubric productionRubric() {
    return rubricLoader().load(new ClassPathResource("rubric/esg_maturity_rubric_v3.json"), 2);
  }

  public static EvidenceQuote quote(String evidenceId, String theme, String text) {
    return quote(evidenceId, theme, text, null);
  }

  public static EvidenceQuote quote(
      String evidenceId, String theme, String text, LocalDate publishedOn) {
    return EvidenceQuote.builder()
        .evidenceId(evidenceId)
        .documentId("doc-" + evidenceId)
        .quote(text)
        .page(1)
        .offset(0)
        .theme(theme)
        .contentHash(StableHash.hex(text.getBytes(StandardCharsets.UTF_8)))
        .publishedOn(publishedOn)
        .build();
  }
}

package com.flamingo.ai.esgmaturity.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.esgmaturity.config.AsyncConfig;
import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.enums.ParityVerdict;
import com.flamingo.ai.esgmaturity.domain.enums.UnitErrorType;
import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.SourceCandidate;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import com.flamingo.ai.esgmaturity.exception.ResolutionFailedException;
import com.flamingo.ai.esgmaturity.service.determinism.StableHash;
import com.flamingo.ai.esgmaturity.service.extraction.PlainTextExtractor;
import com.flamingo.ai.esgmaturity.service.extraction.TextExtractorRouter;
import com.flamingo.ai.esgmaturity.service.parity.ParityValidator;
import com.flamingo.ai.esgmaturity.service.ranking.Bm25LexicalScorer;
import com.flamingo.ai.esgmaturity.service.ranking.HybridRanker;
import com.flamingo.ai.esgmaturity.service.ranking.TokenOverlapSemanticScorer;
import com.flamingo.ai.esgmaturity.service.resolver.CandidateResolver;
import com.flamingo.ai.esgmaturity.service.scoring.EvidenceExtractor;
import com.flamingo.ai.esgmaturity.service.scoring.FreshnessPolicy;
import com.flamingo.ai.esgmaturity.service.scoring.RubricScorer;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import com.flamingo.ai.esgmaturity.service.storage.JsonFileArtifactStore;
import com.flamingo.ai.esgmaturity.support.ScoringFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class ScoringPipelineServiceTest {

  private static final CompanyRef ACME = new CompanyRef("ACME", "Acme Corp", "ACM");
  private static final CompanyRef ZETA = CompanyRef.of("ZETA");

  private static final String GHG_REPORT =
      "Our greenhouse gas inventory covers Scope 1, 2 and 3 emissions in tCO2e.\n\n"
          + "Third-party verification of Scope 1 and 2 emissions was completed with reasonable"
          + " assurance.\n\n"
          + "The auditor report on Scope 3 emissions confirms reasonable assurance.\n\n"
          + "The company sponsors a local football club.";

  @Mock private CandidateResolver candidateResolver;

  @TempDir Path workDir;

  private final Rubric rubric = ScoringFixtures.productionRubric();
  private MeterRegistry meterRegistry;
  private ScoringConfig scoringConfig;
  private ScoringPipelineService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    scoringConfig = new ScoringConfig();
    service = newService(Runnable::run);
  }

  private ScoringPipelineService newService(Executor executor) {
    return new ScoringPipelineService(
        candidateResolver,
        new TextExtractorRouter(List.of(new PlainTextExtractor())),
        new Bm25LexicalScorer(),
        new HybridRanker(new TokenOverlapSemanticScorer(), meterRegistry),
        new EvidenceExtractor(10, 30),
        new RubricScorer(rubric, FreshnessPolicy.defaults(), meterRegistry),
        new ParityValidator(meterRegistry),
        new JsonFileArtifactStore(workDir.resolve("artifacts")),
        rubric,
        ScoringFixtures.fixedContext(),
        scoringConfig,
        meterRegistry,
        executor);
  }

  private ResolvedDocument report(String name, String text) throws IOException {
    Path file = Files.writeString(workDir.resolve(name), text);
    SourceCandidate candidate =
        SourceCandidate.builder()
            .providerId("local")
            .tier(1)
            .priorityScore(10)
            .contentType("text/plain")
            .url(file.toUri().toString())
            .build();
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    return new ResolvedDocument(candidate, file, StableHash.hex(bytes), bytes.length);
  }

  @Nested
  @DisplayName("Single unit")
  class SingleUnitTests {

    @Test
    @DisplayName("should score an assured GHG inventory at stage 4 with passing parity")
    void shouldScoreAssuredInventory() throws IOException {
      when(candidateResolver.resolveBest(ACME, 2024)).thenReturn(report("acme.txt", GHG_REPORT));

      BatchResult result = service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")));

      assertThat(result.errors()).isEmpty();
      StageScore score = result.scores().get(0);
      assertThat(score.stage()).isEqualTo(4);
      assertThat(score.confidence()).isEqualTo(0.92);
      assertThat(score.evidenceIds()).hasSize(2);
      assertThat(score.snapshotId()).isEqualTo(result.snapshotId());
      assertThat(result.parityReports())
          .singleElement()
          .satisfies(p -> assertThat(p.verdict()).isEqualTo(ParityVerdict.PASS));
      assertThat(
              workDir
                  .resolve("artifacts")
                  .resolve(result.snapshotId())
                  .resolve("scores")
                  .resolve("ACME_2024_GHG.json"))
          .exists();
      assertThat(meterRegistry.counter("scoring.pipeline.unit.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should check parity on the spans the score cites and nothing else")
    void shouldCheckParityOnCitedSpans() throws IOException {
      when(candidateResolver.resolveBest(ACME, 2024)).thenReturn(report("acme.txt", GHG_REPORT));

      BatchResult result = service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")));

      StageScore score = result.scores().get(0);
      ParityReport parity = result.parityReports().get(0);
      assertThat(score.sourceIds()).hasSize(2);
      assertThat(parity.evidenceIds()).isEqualTo(score.sourceIds());
      assertThat(parity.topKIds()).containsAll(score.sourceIds());
      // The inventory paragraph only matches a lower stage, so it is not cited.
      assertThat(parity.evidenceIds()).noneMatch(id -> id.endsWith(":1:0"));
    }

    @Test
    @DisplayName("should stay at stage 0 for a report without theme evidence")
    void shouldScoreZeroWithoutEvidence() throws IOException {
      when(candidateResolver.resolveBest(ACME, 2024))
          .thenReturn(report("acme.txt", "The company sponsors a local football club."));

      BatchResult result = service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")));

      assertThat(result.scores()).singleElement().satisfies(s -> assertThat(s.stage()).isZero());
    }

    @Test
    @DisplayName("should report an extraction error for a blank document")
    void shouldFailOnBlankDocument() throws IOException {
      when(candidateResolver.resolveBest(ACME, 2024)).thenReturn(report("blank.txt", " \n\n "));

      BatchResult result = service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")));

      assertThat(result.scores()).isEmpty();
      assertThat(result.errors())
          .singleElement()
          .satisfies(e -> assertThat(e.type()).isEqualTo(UnitErrorType.EXTRACTION_FAILED));
    }

    @Test
    @DisplayName("should not resolve anything once cancelled")
    void shouldHonourCancellation() {
      CancellationToken token = CancellationToken.none();
      token.cancel();

      BatchResult result =
          service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")), 0.5, 5, token);

      assertThat(result.errors())
          .singleElement()
          .satisfies(e -> assertThat(e.type()).isEqualTo(UnitErrorType.CANCELLED));
      verify(candidateResolver, never()).resolveBest(any(), anyInt());
    }
  }

  @Nested
  @DisplayName("Batch")
  class BatchTests {

    @Test
    @DisplayName("should keep successful units when another unit cannot be resolved")
    void shouldIsolateUnitFailures() throws IOException {
      when(candidateResolver.resolveBest(ACME, 2024)).thenReturn(report("acme.txt", GHG_REPORT));
      when(candidateResolver.resolveBest(ZETA, 2024))
          .thenThrow(new ResolutionFailedException("ZETA", 2024, List.of(), null));

      BatchResult result =
          service.runBatch(
              List.of(ScoringUnit.of(ZETA, 2024, "GHG"), ScoringUnit.of(ACME, 2024, "GHG")));

      assertThat(result.outcomes())
          .extracting(o -> o.unit().company().id())
          .containsExactly("ACME", "ZETA");
      assertThat(result.scores()).hasSize(1);
      assertThat(result.errors())
          .singleElement()
          .satisfies(
              e -> {
                assertThat(e.type()).isEqualTo(UnitErrorType.RESOLUTION_FAILED);
                assertThat(e.orgId()).isEqualTo("ZETA");
                assertThat(e.attempts()).isZero();
              });
    }

    @Test
    @DisplayName("should give byte-identical results for identical runs")
    void shouldBeDeterministic() throws IOException {
      ResolvedDocument document = report("acme.txt", GHG_REPORT);
      when(candidateResolver.resolveBest(eq(ACME), anyInt())).thenReturn(document);
      List<ScoringUnit> units =
          List.of(ScoringUnit.of(ACME, 2024, "GHG"), ScoringUnit.of(ACME, 2024, "RD"));

      BatchResult first = service.runBatch(units);
      BatchResult second = service.runBatch(units);

      assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("snapshot id should not depend on unit order")
    void snapshotIdShouldIgnoreUnitOrder() {
      ScoringUnit a = ScoringUnit.of(ACME, 2024, "GHG");
      ScoringUnit b = ScoringUnit.of(ZETA, 2023, "RD");

      assertThat(service.snapshotId(List.of(a, b), 0.5, 5))
          .isEqualTo(service.snapshotId(List.of(b, a), 0.5, 5))
          .isNotEqualTo(service.snapshotId(List.of(a, b), 0.6, 5));
    }

    @Test
    @DisplayName("should reject an unknown theme before running anything")
    void shouldRejectUnknownTheme() {
      assertThatThrownBy(() -> service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "XYZ"))))
          .isInstanceOf(InvalidInputException.class);
      verify(candidateResolver, never()).resolveBest(any(), anyInt());
    }

    @Test
    @DisplayName("should reject an empty batch")
    void shouldRejectEmptyBatch() {
      assertThatThrownBy(() -> service.runBatch(List.of()))
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("should abort the whole batch on a configuration error")
    void shouldPropagateConfigErrors() {
      when(candidateResolver.resolveBest(ACME, 2024))
          .thenThrow(new ConfigException("provider misconfigured"));

      assertThatThrownBy(() -> service.runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG"))))
          .isInstanceOf(ConfigException.class)
          .hasMessage("provider misconfigured");
    }
  }

  @Nested
  @DisplayName("Batch capacity")
  class CapacityTests {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void startExecutor() {
      executor = (ThreadPoolTaskExecutor) new AsyncConfig().scoringUnitExecutor();
    }

    @AfterEach
    void stopExecutor() {
      executor.shutdown();
    }

    @Test
    @DisplayName("should return an outcome for every unit when the batch outgrows the unit queue")
    void shouldRunBatchLargerThanQueue() {
      when(candidateResolver.resolveBest(any(), anyInt()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5);
                CompanyRef company = invocation.getArgument(0);
                int year = invocation.getArgument(1);
                throw new ResolutionFailedException(company.id(), year, List.of(), null);
              });
      List<ScoringUnit> units = new ArrayList<>();
      for (int org = 1; org <= 36; org++) {
        for (RubricTheme theme : rubric.themes()) {
          units.add(ScoringUnit.of(CompanyRef.of(String.format("ORG%02d", org)), 2024, theme.id()));
        }
      }

      BatchResult result = newService(executor).runBatch(units);

      assertThat(units).hasSize(252);
      assertThat(result.outcomes()).hasSize(252);
      assertThat(result.errors())
          .hasSize(252)
          .allSatisfy(e -> assertThat(e.type()).isEqualTo(UnitErrorType.RESOLUTION_FAILED));
      assertThat(result.outcomes().get(0).unit().company().id()).isEqualTo("ORG01");
    }

    @Test
    @DisplayName("should record units as rejected once the executor has shut down")
    void shouldRecordRejectedUnits() {
      executor.shutdown();

      BatchResult result =
          newService(executor).runBatch(List.of(ScoringUnit.of(ACME, 2024, "GHG")));

      assertThat(result.errors())
          .singleElement()
          .satisfies(e -> assertThat(e.type()).isEqualTo(UnitErrorType.REJECTED));
      verify(candidateResolver, never()).resolveBest(any(), anyInt());
    }
  }
}

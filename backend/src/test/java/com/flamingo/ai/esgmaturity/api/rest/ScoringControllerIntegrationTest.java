package com.flamingo.ai.esgmaturity.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.esgmaturity.api.dto.request.ScoringRunRequest;
import com.flamingo.ai.esgmaturity.api.dto.request.ScoringUnitRequest;
import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.enums.ParityVerdict;
import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.domain.model.ParityReport;
import com.flamingo.ai.esgmaturity.domain.model.StageScore;
import com.flamingo.ai.esgmaturity.exception.GlobalExceptionHandler;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import com.flamingo.ai.esgmaturity.service.pipeline.BatchResult;
import com.flamingo.ai.esgmaturity.service.pipeline.ScoringPipelineService;
import com.flamingo.ai.esgmaturity.service.pipeline.ScoringUnit;
import com.flamingo.ai.esgmaturity.service.pipeline.UnitOutcome;
import com.flamingo.ai.esgmaturity.support.ScoringFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScoringController Integration Tests")
class ScoringControllerIntegrationTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private MeterRegistry meterRegistry;

  @Mock private ScoringPipelineService scoringPipelineService;
  @Captor private ArgumentCaptor<List<ScoringUnit>> unitsCaptor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ScoringController controller =
        new ScoringController(
            scoringPipelineService, ScoringFixtures.productionRubric(), new ScoringConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static BatchResult ghgResult() {
    ScoringUnit unit = ScoringUnit.of(CompanyRef.of("ACME"), 2024, "GHG");
    StageScore score =
        new StageScore(
            "ACME",
            2024,
            "GHG",
            4,
            0.92,
            List.of("ev-1", "ev-2"),
            List.of("s1"),
            "snap-1",
            List.of("ok"));
    ParityReport parity =
        new ParityReport("q", List.of("s1"), List.of("s1", "s2"), ParityVerdict.PASS, List.of());
    return new BatchResult("snap-1", List.of(new UnitOutcome(unit, score, parity, null)));
  }

  private String json(ScoringRunRequest request) throws Exception {
    return objectMapper.writeValueAsString(request);
  }

  @Nested
  @DisplayName("POST /api/scoring/runs")
  class RunTests {

    @Test
    @DisplayName("should run the requested units with configured defaults")
    void shouldRunRequestedUnits() throws Exception {
      when(scoringPipelineService.runBatch(anyList(), eq(0.5), eq(5), any()))
          .thenReturn(ghgResult());
      ScoringRunRequest request =
          ScoringRunRequest.builder()
              .units(
                  List.of(
                      ScoringUnitRequest.builder()
                          .orgId("ACME")
                          .year(2024)
                          .themes(List.of("GHG"))
                          .build()))
              .build();

      mockMvc
          .perform(
              post("/api/scoring/runs")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.snapshotId").value("snap-1"))
          .andExpect(jsonPath("$.scores[0].org_id").value("ACME"))
          .andExpect(jsonPath("$.scores[0].stage").value(4))
          .andExpect(jsonPath("$.parityReports[0].verdict").value("PASS"))
          .andExpect(jsonPath("$.errors").isEmpty());

      verify(scoringPipelineService).runBatch(unitsCaptor.capture(), eq(0.5), eq(5), any());
      assertThat(unitsCaptor.getValue())
          .singleElement()
          .satisfies(u -> assertThat(u.themeId()).isEqualTo("GHG"));
    }

    @Test
    @DisplayName("should expand a unit without themes to every rubric theme")
    void shouldExpandAllThemes() throws Exception {
      when(scoringPipelineService.runBatch(anyList(), eq(0.2), eq(3), any()))
          .thenReturn(ghgResult());
      ScoringRunRequest request =
          ScoringRunRequest.builder()
              .units(List.of(ScoringUnitRequest.builder().orgId("ACME").year(2024).build()))
              .alpha(0.2)
              .topK(3)
              .build();

      mockMvc
          .perform(
              post("/api/scoring/runs")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isOk());

      verify(scoringPipelineService).runBatch(unitsCaptor.capture(), eq(0.2), eq(3), any());
      assertThat(unitsCaptor.getValue())
          .extracting(ScoringUnit::themeId)
          .containsExactly("TSP", "OSP", "DM", "GHG", "RD", "EI", "RMM");
    }

    @Test
    @DisplayName("should reject a unit without organisation id")
    void shouldRejectMissingOrgId() throws Exception {
      ScoringRunRequest request =
          ScoringRunRequest.builder()
              .units(List.of(ScoringUnitRequest.builder().year(2024).build()))
              .build();

      mockMvc
          .perform(
              post("/api/scoring/runs")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"))
          .andExpect(jsonPath("$.message").value("units[0].orgId: Organisation id is required"));

      verify(scoringPipelineService, never()).runBatch(anyList(), anyDouble(), anyInt(), any());
    }

    @Test
    @DisplayName("should reject alpha above 1")
    void shouldRejectBadAlpha() throws Exception {
      ScoringRunRequest request =
          ScoringRunRequest.builder()
              .units(List.of(ScoringUnitRequest.builder().orgId("ACME").year(2024).build()))
              .alpha(1.5)
              .build();

      mockMvc
          .perform(
              post("/api/scoring/runs")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("alpha: Alpha must be between 0 and 1"));
    }

    @Test
    @DisplayName("should answer malformed JSON with a client error")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/scoring/runs").contentType(MediaType.APPLICATION_JSON).content("{units:"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_002"));
    }

    @Test
    @DisplayName("should map an unknown theme to a client error")
    void shouldMapInvalidInput() throws Exception {
      when(scoringPipelineService.runBatch(anyList(), anyDouble(), anyInt(), any()))
          .thenThrow(new InvalidInputException("Unknown rubric theme: XYZ"));
      ScoringRunRequest request =
          ScoringRunRequest.builder()
              .units(
                  List.of(
                      ScoringUnitRequest.builder()
                          .orgId("ACME")
                          .year(2024)
                          .themes(List.of("XYZ"))
                          .build()))
              .build();

      mockMvc
          .perform(
              post("/api/scoring/runs")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("INPUT_001"))
          .andExpect(jsonPath("$.message").value("Unknown rubric theme: XYZ"));

      assertThat(meterRegistry.counter("api_errors_total", "error_type", "invalid_input").count())
          .isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("GET /api/scoring/rubric should describe the loaded rubric")
  void shouldDescribeRubric() throws Exception {
    mockMvc
        .perform(get("/api/scoring/rubric"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value("3.0"))
        .andExpect(jsonPath("$.minQuotes").value(2))
        .andExpect(jsonPath("$.themes.length()").value(7))
        .andExpect(jsonPath("$.themes[3].id").value("GHG"))
        .andExpect(jsonPath("$.themes[3].stages[3].stage").value(4));
  }
}

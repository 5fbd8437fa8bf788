package com.flamingo.ai.esgmaturity.api.rest;

import com.flamingo.ai.esgmaturity.api.dto.request.ScoringRunRequest;
import com.flamingo.ai.esgmaturity.api.dto.request.ScoringUnitRequest;
import com.flamingo.ai.esgmaturity.api.dto.response.RubricResponse;
import com.flamingo.ai.esgmaturity.api.dto.response.ScoringRunResponse;
import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.service.pipeline.BatchResult;
import com.flamingo.ai.esgmaturity.service.pipeline.CancellationToken;
import com.flamingo.ai.esgmaturity.service.pipeline.ScoringPipelineService;
import com.flamingo.ai.esgmaturity.service.pipeline.ScoringUnit;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.Rubric;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for scoring runs and the active rubric. */
@RestController
@RequestMapping("/api/scoring")
@RequiredArgsConstructor
@Slf4j
public class ScoringController {

  private final ScoringPipelineService scoringPipelineService;
  private final Rubric rubric;
  private final ScoringConfig scoringConfig;

  /** Scores every requested (organisation, year, theme) unit and returns the batch outcome. */
  @PostMapping("/runs")
  public ResponseEntity<ScoringRunResponse> run(@Valid @RequestBody ScoringRunRequest request) {
    List<ScoringUnit> units = toUnits(request);
    double alpha =
        request.getAlpha() != null ? request.getAlpha() : scoringConfig.getRetrieval().getAlpha();
    int topK =
        request.getTopK() != null ? request.getTopK() : scoringConfig.getRetrieval().getTopK();
    log.info("Scoring run requested for {} units", units.size());

    BatchResult result =
        scoringPipelineService.runBatch(units, alpha, topK, CancellationToken.none());
    return ResponseEntity.ok(ScoringRunResponse.from(result));
  }

  /** Returns theme ids, names and stage labels of the loaded rubric. */
  @GetMapping("/rubric")
  public ResponseEntity<RubricResponse> rubric() {
    return ResponseEntity.ok(RubricResponse.from(rubric));
  }

  private List<ScoringUnit> toUnits(ScoringRunRequest request) {
    List<ScoringUnit> units = new ArrayList<>();
    for (ScoringUnitRequest unit : request.getUnits()) {
      CompanyRef company = new CompanyRef(unit.getOrgId(), unit.getName(), unit.getTicker());
      List<String> themes =
          unit.getThemes() == null || unit.getThemes().isEmpty()
              ? rubric.themes().stream().map(RubricTheme::id).toList()
              : unit.getThemes();
      for (String theme : themes) {
        units.add(new ScoringUnit(company, unit.getYear(), theme, unit.getQuery()));
      }
    }
    return units;
  }
}

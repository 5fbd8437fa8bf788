package com.flamingo.ai.esgmaturity.service.scoring.rubric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import com.flamingo.ai.esgmaturity.support.ScoringFixtures;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class RubricLoaderTest {

  private final RubricLoader loader = ScoringFixtures.rubricLoader();

  private Rubric parse(String json) throws IOException {
    return loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), 2);
  }

  private static String rubric(String stagesJson) {
    return "{\"version\":\"t\",\"themes\":[{\"id\":\"GHG\",\"name\":\"GHG\",\"query\":\"q\","
        + "\"stages\":"
        + stagesJson
        + "}]}";
  }

  @Nested
  @DisplayName("Bundled rubric")
  class BundledRubricTests {

    @Test
    @DisplayName("should load all seven themes in definition order")
    void shouldLoadThemesInOrder() {
      Rubric rubric = ScoringFixtures.productionRubric();

      assertThat(rubric.version()).isEqualTo("3.0");
      assertThat(rubric.defaultMinQuotes()).isEqualTo(2);
      assertThat(rubric.themes())
          .extracting(RubricTheme::id)
          .containsExactly("TSP", "OSP", "DM", "GHG", "RD", "EI", "RMM");
    }

    @Test
    @DisplayName("every theme should define stages 1 to 4 with a query")
    void everyThemeShouldBeComplete() {
      assertThat(ScoringFixtures.productionRubric().themes())
          .allSatisfy(
              theme -> {
                assertThat(theme.query()).isNotBlank();
                assertThat(theme.stages())
                    .extracting(RubricStage::stage)
                    .containsExactly(1, 2, 3, 4);
              });
    }

    @Test
    @DisplayName("GHG stage 4 should recognise reasonable assurance in any case")
    void ghgStageFourShouldMatch() {
      RubricTheme ghg = ScoringFixtures.productionRubric().requireTheme("GHG");

      assertThat(ghg.stages().get(3).matches("Obtained REASONABLE assurance over Scope 1."))
          .isTrue();
      assertThat(ghg.stages().get(3).matches("We publish a sustainability report.")).isFalse();
    }

    @Test
    @DisplayName("should reject unknown theme ids")
    void shouldRejectUnknownTheme() {
      assertThatThrownBy(() -> ScoringFixtures.productionRubric().requireTheme("XYZ"))
          .isInstanceOf(InvalidInputException.class)
          .hasMessageContaining("XYZ");
    }
  }

  @Nested
  @DisplayName("Invalid definitions")
  class InvalidDefinitionTests {

    @Test
    @DisplayName("should fail on a missing resource")
    void shouldFailOnMissingResource() {
      assertThatThrownBy(() -> loader.load(new ClassPathResource("rubric/missing.json"), 2))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
      assertThatThrownBy(() -> parse("{\"version\": "))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("should fail on unknown properties")
    void shouldFailOnUnknownProperty() {
      assertThatThrownBy(() -> parse("{\"version\":\"t\",\"themes\":[],\"weights\":{}}"))
          .isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("should fail on an invalid regex")
    void shouldFailOnBadRegex() {
      assertThatThrownBy(
              () -> parse(rubric("[{\"stage\":1,\"label\":\"a\",\"patterns\":[\"(unclosed\"]}]")))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("invalid pattern");
    }

    @Test
    @DisplayName("should fail on a stage outside 1 to 4")
    void shouldFailOnStageOutOfRange() {
      assertThatThrownBy(
              () -> parse(rubric("[{\"stage\":5,\"label\":\"a\",\"keywords\":[\"net zero\"]}]")))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("validation");
    }

    @Test
    @DisplayName("should fail on a stage without signals")
    void shouldFailOnEmptyStage() {
      assertThatThrownBy(() -> parse(rubric("[{\"stage\":1,\"label\":\"a\"}]")))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("no patterns or keywords");
    }

    @Test
    @DisplayName("should fail on a stage defined twice")
    void shouldFailOnDuplicateStage() {
      String stages =
          "[{\"stage\":1,\"label\":\"a\",\"keywords\":[\"x\"]},"
              + "{\"stage\":1,\"label\":\"b\",\"keywords\":[\"y\"]}]";

      assertThatThrownBy(() -> parse(rubric(stages)))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("twice");
    }

    @Test
    @DisplayName("should fail on a theme defined twice")
    void shouldFailOnDuplicateTheme() {
      String theme =
          "{\"id\":\"GHG\",\"name\":\"n\",\"query\":\"q\","
              + "\"stages\":[{\"stage\":1,\"label\":\"a\",\"keywords\":[\"x\"]}]}";

      assertThatThrownBy(
              () -> parse("{\"version\":\"t\",\"themes\":[" + theme + "," + theme + "]}"))
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("Duplicate rubric theme");
    }

    @Test
    @DisplayName("should use the fallback minimum when the rubric has none")
    void shouldUseFallbackMinQuotes() throws IOException {
      Rubric parsed = parse(rubric("[{\"stage\":2,\"label\":\"a\",\"keywords\":[\"Net Zero\"]}]"));

      assertThat(parsed.defaultMinQuotes()).isEqualTo(2);
      assertThat(parsed.requireTheme("GHG").matchesAnyStage("our net zero pledge")).isTrue();
    }
  }
}

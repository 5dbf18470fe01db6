package io.aim.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.aim.core.exception.MetricNotFoundException;
import io.aim.core.exception.RegistryValidationException;
import io.aim.core.metric.MetricRegistry;
import io.aim.core.metric.model.Icon;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ScoreBand;
import io.aim.core.metric.model.Speed;
import io.aim.core.metric.model.ValueType;
import io.aim.core.metric.model.VisualizationType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricRegistryLoaderTest {

    private static final String PNG_SIZE =
            """
            "m1": {
              "id": "m1",
              "name": "PNG File Size",
              "category": "cp",
              "description": "File size in PNG.",
              "evidence": 1,
              "relevance": 2,
              "speed": 2,
              "visualizationType": "table",
              "references": [
                {"title": "Computation of Interface Aesthetics.", "fileName": "miniukovich_2015.pdf"}
              ],
              "results": [{
                "id": "m1_0", "index": 0, "type": "int", "name": "PNG File Size (in bytes)",
                "description": false,
                "scores": [
                  {"id": "r1", "range": [0, 500000], "description": "Suitable",
                   "icon": ["far", "check-circle"], "judgment": "good"},
                  {"id": "r2", "range": [500001, 1200000], "description": "Fair",
                   "icon": [null, null], "judgment": "normal"},
                  {"id": "r3", "range": [1200001, null], "description": "Huge",
                   "icon": ["fas", "exclamation-triangle"], "judgment": "bad"}
                ]
              }]
            }
            """;

    private static final String COLOR_BLINDNESS =
            """
            "m23": {
              "id": "m23",
              "name": "Color blindness",
              "category": "ac",
              "evidence": 4,
              "relevance": 5,
              "speed": 1,
              "visualizationType": "b64",
              "results": [
                {"id": "m23_0", "index": 0, "type": "b64", "name": "Protanopia",
                 "description": "Lacking red cones."},
                {"id": "m23_1", "index": 1, "type": "b64", "name": "Deuteranopia"}
              ]
            }
            """;

    private static String document(String... metrics) {
        return "{" + String.join(",", metrics) + "}";
    }

    @Nested
    class ParsingTest {

        @Test
        void shouldReadEveryField() throws MetricNotFoundException {
            // When
            MetricRegistry registry = MetricRegistryLoader.fromJson(document(PNG_SIZE));

            // Then
            MetricDescriptor metric = registry.lookup("m1");
            assertThat(metric.getName()).isEqualTo("PNG File Size");
            assertThat(metric.getCategoryId()).isEqualTo("cp");
            assertThat(metric.getEvidence()).isEqualTo(1);
            assertThat(metric.getRelevance()).isEqualTo(2);
            assertThat(metric.getSpeed()).isEqualTo(Speed.FAST);
            assertThat(metric.getVisualizationType()).isEqualTo(VisualizationType.TABLE);
            assertThat(metric.getReferences()).singleElement()
                    .satisfies(reference -> assertThat(reference.fileName()).isEqualTo("miniukovich_2015.pdf"));

            ResultDescriptor result = metric.getResults().get(0);
            assertThat(result.valueType()).isEqualTo(ValueType.INTEGER);
            assertThat(result.findDescription()).isEmpty();
            assertThat(result.bands()).extracting(ScoreBand::judgment).containsExactly("good", "normal", "bad");
        }

        @Test
        void shouldReadOpenRangesAndEmptyIcons() throws MetricNotFoundException {
            MetricRegistry registry = MetricRegistryLoader.fromJson(document(PNG_SIZE));

            ResultDescriptor result = registry.lookup("m1").getResults().get(0);
            ScoreBand fair = result.bands().get(1);
            ScoreBand huge = result.bands().get(2);

            assertThat(fair.icon()).isEqualTo(Icon.NONE);
            assertThat(huge.range().min()).isEqualTo(1200001.0);
            assertThat(huge.range().isUnboundedHigh()).isTrue();
            assertThat(huge.icon()).isEqualTo(new Icon("fas", "exclamation-triangle"));
        }

        @Test
        void shouldReadImageResultsWithoutBands() throws MetricNotFoundException {
            MetricRegistry registry = MetricRegistryLoader.fromJson(document(PNG_SIZE, COLOR_BLINDNESS));

            MetricDescriptor metric = registry.lookup("m23");
            assertThat(metric.getVisualizationType()).isEqualTo(VisualizationType.IMAGE);
            assertThat(metric.getSpeed()).isEqualTo(Speed.MEDIUM);
            assertThat(metric.getResults()).allSatisfy(result -> {
                assertThat(result.valueType()).isEqualTo(ValueType.IMAGE);
                assertThat(result.bands()).isEmpty();
            });
            assertThat(metric.getResults().get(0).findDescription()).contains("Lacking red cones.");
            assertThat(registry.categories()).containsExactly("cp", "ac");
        }

        @Test
        void shouldLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("metrics.json");
            Files.writeString(file, document(PNG_SIZE));

            assertThat(MetricRegistryLoader.load(file).contains("m1")).isTrue();
        }

        @Test
        void shouldLoadFromClasspath() {
            MetricRegistry registry = MetricRegistryLoader.loadResource("registry/two-metrics.json");

            assertThat(registry.all()).extracting(MetricDescriptor::getId).containsExactly("m1", "m23");
        }
    }

    @Nested
    class RejectionTest {

        @Test
        void shouldRejectDuplicateKeys() {
            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(PNG_SIZE, PNG_SIZE)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Duplicate field 'm1'");
        }

        @Test
        void shouldRejectKeyDifferentFromId() {
            String renamed = PNG_SIZE.replaceFirst("\"m1\":", "\"m9\":");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(renamed)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric declared under key 'm9' has id 'm1'");
        }

        @Test
        void shouldReportAllStructuralProblemsTogether() {
            // Given
            String broken =
                    PNG_SIZE.replace("\"index\": 0", "\"index\": 1")
                            .replace("[500001, 1200000]", "[1200000, 500001]");

            // When / Then
            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(broken)))
                    .isInstanceOfSatisfying(
                            RegistryValidationException.class,
                            e -> assertThat(e.getProblems()).hasSize(2));
        }

        @Test
        void shouldRejectMissingRequiredField() {
            String nameless = PNG_SIZE.replace("\"name\": \"PNG File Size\",", "");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(nameless)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' is missing field 'name'");
        }

        @Test
        void shouldRejectNonIntegralRatings() {
            String textual = PNG_SIZE.replace("\"evidence\": 1", "\"evidence\": \"high\"");
            String fractional = PNG_SIZE.replace("\"speed\": 2", "\"speed\": 1.7");
            String boolRelevance = PNG_SIZE.replace("\"relevance\": 2", "\"relevance\": true");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(textual)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' field 'evidence' must be an integer");
            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(fractional)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' field 'speed' must be an integer, got 1.7");
            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(boolRelevance)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' field 'relevance' must be an integer");
        }

        @Test
        void shouldRejectMissingRatings() {
            String speedless = PNG_SIZE.replace("\"speed\": 2,", "");
            String evidenceless = PNG_SIZE.replace("\"evidence\": 1,", "");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(speedless)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' is missing field 'speed'");
            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(evidenceless)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Metric 'm1' is missing field 'evidence'");
        }

        @Test
        void shouldRejectFractionalResultIndex() {
            String fractional = PNG_SIZE.replace("\"index\": 0", "\"index\": 0.5");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(fractional)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Result 'm1_0' of metric 'm1' field 'index' must be an integer");
        }

        @Test
        void shouldRejectMalformedRange() {
            String malformed = PNG_SIZE.replace("[0, 500000]", "[0]");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(malformed)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("range must be [min, max]");
        }

        @Test
        void shouldRejectUnknownValueType() {
            String unknown = PNG_SIZE.replace("\"type\": \"int\"", "\"type\": \"text\"");

            assertThatThrownBy(() -> MetricRegistryLoader.fromJson(document(unknown)))
                    .isInstanceOf(RegistryValidationException.class)
                    .hasMessageContaining("Result 'm1_0' of metric 'm1'");
        }

        @Test
        void shouldRejectMissingResource() {
            assertThatThrownBy(() -> MetricRegistryLoader.loadResource("registry/missing.json"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldReadBackSerializedRegistry() throws MetricNotFoundException {
        MetricRegistry original = MetricRegistryLoader.fromJson(document(PNG_SIZE, COLOR_BLINDNESS));

        MetricRegistry restored = MetricRegistryLoader.fromJson(AimSerializer.toJson(original));

        assertThat(restored.all()).containsExactlyElementsOf(original.all());
        assertThat(restored.lookup("m1").getResults().get(0).findDescription()).isEmpty();
    }
}

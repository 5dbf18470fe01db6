package io.aim.core.metric;

import static io.aim.core.TestFixtures.fileSizeBands;
import static io.aim.core.TestFixtures.integerMetric;
import static io.aim.core.TestFixtures.metric;
import static io.aim.core.TestFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;

import io.aim.core.metric.model.Icon;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ScoreBand;
import io.aim.core.metric.model.ScoreRange;
import io.aim.core.metric.model.Speed;
import io.aim.core.metric.model.ValueType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MetricRegistryValidatorTest {

    @Test
    void shouldAcceptValidMetrics() {
        // When
        List<String> problems =
                MetricRegistryValidator.validate(
                        List.of(integerMetric("m1", Speed.FAST), integerMetric("m2", Speed.SLOW)));

        // Then
        assertThat(problems).isEmpty();
    }

    @Test
    void shouldRejectDuplicateIds() {
        List<String> problems =
                MetricRegistryValidator.validate(
                        List.of(integerMetric("m1", Speed.FAST), integerMetric("m1", Speed.SLOW)));

        assertThat(problems).containsExactly("Duplicate metric id 'm1'");
    }

    @Test
    void shouldRejectKeyThatDiffersFromEmbeddedId() {
        // Given
        Map<String, MetricDescriptor> document = new LinkedHashMap<>();
        document.put("m9", integerMetric("m1", Speed.FAST));

        // When
        List<String> problems = MetricRegistryValidator.validate(document);

        // Then
        assertThat(problems).containsExactly("Metric declared under key 'm9' has id 'm1'");
    }

    @Test
    void shouldRejectRatingsOutOfRange() {
        MetricDescriptor metric =
                MetricDescriptor.builder()
                        .id("m1")
                        .categoryId("cp")
                        .name("PNG")
                        .evidence(0)
                        .relevance(6)
                        .result(result("m1_0", 0, ValueType.INTEGER, fileSizeBands()))
                        .build();

        assertThat(MetricRegistryValidator.validate(List.of(metric)))
                .containsExactly(
                        "Metric 'm1' evidence must be between 1 and 5, got 0",
                        "Metric 'm1' relevance must be between 1 and 5, got 6");
    }

    @Nested
    class ResultIndicesTest {

        @Test
        void shouldRejectGapInIndices() {
            MetricDescriptor metric =
                    metric(
                            "m16",
                            Speed.FAST,
                            result("m16_0", 0, ValueType.FLOAT, List.of()),
                            result("m16_2", 2, ValueType.FLOAT, List.of()));

            assertThat(MetricRegistryValidator.validate(List.of(metric)))
                    .containsExactly("Metric 'm16' result indices must be contiguous from 0, missing 1");
        }

        @Test
        void shouldRejectRepeatedIndex() {
            MetricDescriptor metric =
                    metric(
                            "m16",
                            Speed.FAST,
                            result("m16_0", 0, ValueType.FLOAT, List.of()),
                            result("m16_1", 0, ValueType.FLOAT, List.of()));

            assertThat(MetricRegistryValidator.validate(List.of(metric)))
                    .contains("Metric 'm16' declares result index 0 twice")
                    .contains("Metric 'm16' result indices must be contiguous from 0, missing 1");
        }

        @Test
        void shouldAcceptIndicesDeclaredOutOfOrder() {
            MetricDescriptor metric =
                    metric(
                            "m16",
                            Speed.FAST,
                            result("m16_1", 1, ValueType.FLOAT, List.of()),
                            result("m16_0", 0, ValueType.FLOAT, List.of()));

            assertThat(MetricRegistryValidator.validate(List.of(metric))).isEmpty();
        }

        @Test
        void shouldRejectMetricWithoutResults() {
            MetricDescriptor metric = metric("m0", Speed.FAST);

            assertThat(MetricRegistryValidator.validate(List.of(metric)))
                    .containsExactly("Metric 'm0' declares no results");
        }
    }

    @Nested
    class BandsTest {

        @Test
        void shouldRejectInvertedRange() {
            ScoreBand inverted = new ScoreBand("r1", ScoreRange.of(10.0, 5.0), "good", "Bad range", Icon.NONE);
            MetricDescriptor metric =
                    metric("m1", Speed.FAST, result("m1_0", 0, ValueType.INTEGER, List.of(inverted)));

            assertThat(MetricRegistryValidator.validate(List.of(metric)))
                    .singleElement()
                    .asString()
                    .contains("Band 'r1' of m1/m1_0 has min greater than max");
        }

        @Test
        void shouldRejectBandShadowedByEarlierUnboundedBand() {
            // Given
            List<ScoreBand> bands =
                    List.of(
                            new ScoreBand("r1", ScoreRange.atLeast(0.0), "good", "Any", Icon.NONE),
                            new ScoreBand("r2", ScoreRange.of(10.0, 20.0), "bad", "Never", Icon.NONE));
            MetricDescriptor metric =
                    metric("m1", Speed.FAST, result("m1_0", 0, ValueType.INTEGER, bands));

            // When
            List<String> problems = MetricRegistryValidator.validate(List.of(metric));

            // Then
            assertThat(problems)
                    .singleElement()
                    .asString()
                    .contains("Band 'r2' of m1/m1_0 is unreachable")
                    .contains("'r1'");
        }

        @Test
        void shouldAcceptOverlappingButReachableBands() {
            List<ScoreBand> bands =
                    List.of(
                            new ScoreBand("r1", ScoreRange.of(0.0, 10.0), "good", "Low", Icon.NONE),
                            new ScoreBand("r2", ScoreRange.of(5.0, 20.0), "bad", "High", Icon.NONE));
            MetricDescriptor metric =
                    metric("m1", Speed.FAST, result("m1_0", 0, ValueType.INTEGER, bands));

            assertThat(MetricRegistryValidator.validate(List.of(metric))).isEmpty();
        }
    }

    @Test
    void shouldReportAllProblemsTogether() {
        // Given
        ScoreBand inverted = new ScoreBand("r1", ScoreRange.of(3.0, 1.0), "good", "x", Icon.NONE);
        MetricDescriptor broken =
                metric("m3", Speed.FAST, result("m3_0", 1, ValueType.INTEGER, List.of(inverted)));

        // When
        List<String> problems =
                MetricRegistryValidator.validate(
                        List.of(integerMetric("m1", Speed.FAST), integerMetric("m1", Speed.FAST), broken));

        // Then
        assertThat(problems).hasSize(3);
    }
}

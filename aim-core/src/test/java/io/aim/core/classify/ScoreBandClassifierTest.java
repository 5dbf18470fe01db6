package io.aim.core.classify;

import static io.aim.core.TestFixtures.fileSizeBands;
import static io.aim.core.TestFixtures.integerMetric;
import static io.aim.core.TestFixtures.metric;
import static io.aim.core.TestFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;

import io.aim.core.evaluator.ResultValue;
import io.aim.core.metric.model.Icon;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ScoreBand;
import io.aim.core.metric.model.ScoreRange;
import io.aim.core.metric.model.Speed;
import io.aim.core.metric.model.ValueType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ScoreBandClassifierTest {

    private final ResultClassifier classifier = new ScoreBandClassifier();

    @ParameterizedTest
    @CsvSource({
        "0, r1, good",
        "340000, r1, good",
        "500000, r1, good",
        "500001, r2, normal",
        "1200000, r2, normal",
        "1200001, r3, bad",
        "98000000, r3, bad"
    })
    void shouldPickFirstBandContainingValue(double value, String bandId, String label) {
        // When
        Optional<Judgment> judgment = classifier.classify(value, fileSizeBands());

        // Then
        assertThat(judgment).isPresent();
        assertThat(judgment.get().bandId()).isEqualTo(bandId);
        assertThat(judgment.get().label()).isEqualTo(label);
    }

    @Test
    void shouldReturnEmptyForValueBetweenBands() {
        // Given
        List<ScoreBand> bands =
                List.of(
                        new ScoreBand("r1", ScoreRange.of(0.0, 0.10), "good", "Low", Icon.NONE),
                        new ScoreBand("r2", ScoreRange.of(0.11, 0.60), "normal", "Medium", Icon.NONE));

        // Then
        assertThat(classifier.classify(0.105, bands)).isEmpty();
        assertThat(classifier.classify(-1.0, bands)).isEmpty();
    }

    @Test
    void shouldPreferEarlierBandWhenRangesOverlap() {
        List<ScoreBand> bands =
                List.of(
                        new ScoreBand("low", ScoreRange.of(0.0, 10.0), "good", "Low", Icon.NONE),
                        new ScoreBand("mid", ScoreRange.of(5.0, 20.0), "normal", "Mid", Icon.NONE));

        assertThat(classifier.classify(7.0, bands)).map(Judgment::bandId).contains("low");
    }

    @Test
    void shouldBeDeterministic() {
        List<ScoreBand> bands = fileSizeBands();

        Optional<Judgment> first = classifier.classify(500000.0, bands);
        for (int i = 0; i < 100; i++) {
            assertThat(classifier.classify(500000.0, bands)).isEqualTo(first);
        }
    }

    @Test
    void shouldCarryBandPresentation() {
        Judgment judgment = classifier.classify(1.0, fileSizeBands()).orElseThrow();

        assertThat(judgment.description()).isEqualTo("Suitable");
        assertThat(judgment.icon()).isEqualTo(new Icon("far", "check-circle"));
    }

    @Test
    void shouldClassifyAllValuesAndSkipImages() {
        // Given
        MetricDescriptor metric =
                metric(
                        "m23",
                        Speed.SLOW,
                        result("m23_0", 0, ValueType.IMAGE, List.of()),
                        result("m23_1", 1, ValueType.INTEGER, fileSizeBands()));

        // When
        List<ResultEntry> entries =
                classifier.classifyAll(metric, List.of(ResultValue.image("aGVsbG8="), ResultValue.of(600000L)));

        // Then
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).resultId()).isEqualTo("m23_0");
        assertThat(entries.get(0).findJudgment()).isEmpty();
        assertThat(entries.get(1).index()).isEqualTo(1);
        assertThat(entries.get(1).judgment().label()).isEqualTo("normal");
    }

    @Test
    void shouldClassifyIntegerValueAgainstItsResult() {
        MetricDescriptor metric = integerMetric("m1", Speed.FAST);

        Optional<Judgment> judgment =
                classifier.classify(ResultValue.of(340000L), metric.getResults().get(0));

        assertThat(judgment).map(Judgment::label).contains("good");
    }
}

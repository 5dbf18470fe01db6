package io.aim.core.metric.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScoreRangeTest {

    @Test
    void shouldIncludeBothBounds() {
        // Given
        ScoreRange range = ScoreRange.of(0.0, 500000.0);

        // Then
        assertThat(range.contains(0.0)).isTrue();
        assertThat(range.contains(500000.0)).isTrue();
        assertThat(range.contains(-0.5)).isFalse();
        assertThat(range.contains(500000.5)).isFalse();
    }

    @Test
    void shouldTreatNullBoundsAsUnbounded() {
        assertThat(ScoreRange.atLeast(1200001).contains(Double.MAX_VALUE)).isTrue();
        assertThat(ScoreRange.atMost(0.1).contains(-Double.MAX_VALUE)).isTrue();
        assertThat(ScoreRange.UNBOUNDED.contains(42.0)).isTrue();
    }

    @Test
    void shouldNeverContainNaN() {
        assertThat(ScoreRange.UNBOUNDED.contains(Double.NaN)).isFalse();
        assertThat(ScoreRange.of(0.0, 1.0).contains(Double.NaN)).isFalse();
    }

    @Test
    void shouldReportInvertedRangeAndContainNothing() {
        // When
        ScoreRange range = ScoreRange.of(10.0, 5.0);

        // Then
        assertThat(range.isInverted()).isTrue();
        assertThat(range.contains(7.0)).isFalse();
    }

    @Test
    void shouldDetectCoveredRanges() {
        ScoreRange wide = ScoreRange.atLeast(0.0);

        assertThat(wide.covers(ScoreRange.of(5.0, 10.0))).isTrue();
        assertThat(wide.covers(ScoreRange.atLeast(3.0))).isTrue();
        assertThat(wide.covers(ScoreRange.atMost(10.0))).isFalse();
        assertThat(ScoreRange.of(0.0, 10.0).covers(ScoreRange.of(5.0, 11.0))).isFalse();
        assertThat(ScoreRange.UNBOUNDED.covers(ScoreRange.UNBOUNDED)).isTrue();
    }

    @Test
    void shouldFormatBounds() {
        assertThat(ScoreRange.atLeast(1.0).toString()).isEqualTo("[1.0, +inf]");
    }
}

package io.aim.core.metric.model;

/// Closed numeric interval used by score bands.
///
/// Either bound may be `null`, meaning the interval is unbounded on that side.
/// Both bounds are inclusive: a value `v` is contained when `min <= v <= max`.
/// An inverted range (`min > max`) can be constructed so that registry
/// validation can report it alongside other problems; it contains nothing.
///
/// @param min lower bound, or `null` for unbounded-low
/// @param max upper bound, or `null` for unbounded-high
public record ScoreRange(Double min, Double max) {

    /// Range that contains every non-NaN value.
    public static final ScoreRange UNBOUNDED = new ScoreRange(null, null);

    /// Creates a range from two inclusive bounds.
    ///
    /// @param min lower bound, may be null
    /// @param max upper bound, may be null
    /// @return the range, never null
    public static ScoreRange of(Double min, Double max) {
        return new ScoreRange(min, max);
    }

    /// Creates a range unbounded on the high side.
    ///
    /// @param min inclusive lower bound
    /// @return the range, never null
    public static ScoreRange atLeast(double min) {
        return new ScoreRange(min, null);
    }

    /// Creates a range unbounded on the low side.
    ///
    /// @param max inclusive upper bound
    /// @return the range, never null
    public static ScoreRange atMost(double max) {
        return new ScoreRange(null, max);
    }

    /// Tests whether a value falls within this range.
    ///
    /// `NaN` is never contained, not even by {@link #UNBOUNDED}.
    ///
    /// @param value the value to test
    /// @return `true` if `min <= value <= max`, treating null bounds as satisfied
    public boolean contains(double value) {
        if (Double.isNaN(value)) {
            return false;
        }
        return (min == null || min <= value) && (max == null || value <= max);
    }

    /// Tests whether every value of `other` is also contained in this range.
    ///
    /// @param other the range to test, not null
    /// @return `true` if `other` is a subset of this range
    public boolean covers(ScoreRange other) {
        boolean lowCovered = min == null || (other.min != null && min <= other.min);
        boolean highCovered = max == null || (other.max != null && other.max <= max);
        return lowCovered && highCovered;
    }

    /// Returns whether the lower bound exceeds the upper bound.
    ///
    /// @return `true` if both bounds are present and `min > max`
    public boolean isInverted() {
        return min != null && max != null && min > max;
    }

    public boolean isUnboundedLow() {
        return min == null;
    }

    public boolean isUnboundedHigh() {
        return max == null;
    }

    @Override
    public String toString() {
        return "[" + (min == null ? "-inf" : min) + ", " + (max == null ? "+inf" : max) + "]";
    }
}

package io.aim.core.metric.model;

/// Declared relative cost of computing a metric.
///
/// The numeric rating is the value used in the registry document; a higher
/// rating means a cheaper metric.
public enum Speed {
    SLOW(0),
    MEDIUM(1),
    FAST(2);

    private final int rating;

    Speed(int rating) {
        this.rating = rating;
    }

    public int getRating() {
        return rating;
    }

    /// Resolves a document rating.
    ///
    /// @param rating `0` (slow), `1` (medium) or `2` (fast)
    /// @return the matching speed, never null
    /// @throws IllegalArgumentException if the rating is out of range
    public static Speed fromRating(int rating) {
        for (Speed speed : values()) {
            if (speed.rating == rating) {
                return speed;
            }
        }
        throw new IllegalArgumentException("Speed must be 0, 1 or 2, got " + rating);
    }
}

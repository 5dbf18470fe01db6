package io.aim.core.metric.model;

import java.util.Objects;

/// A labelled interval of raw result values.
///
/// Bands of one result are evaluated in declared order; the first band whose
/// {@link ScoreRange} contains a value supplies that value's judgment.
///
/// @param id band identifier, unique within its result, not null
/// @param range inclusive value range, not null
/// @param judgment qualitative label (e.g. `"good"`, `"normal"`, `"bad"`), not null
/// @param description human readable text shown with the judgment, not null
/// @param icon presentation icon, not null (use {@link Icon#NONE})
public record ScoreBand(
        String id, ScoreRange range, String judgment, String description, Icon icon) {

    public ScoreBand {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(judgment, "judgment must not be null");
        Objects.requireNonNull(description, "description must not be null");
        icon = icon != null ? icon : Icon.NONE;
    }

    /// Tests whether the value falls within this band's range.
    ///
    /// @param value raw result value
    /// @return `true` if the range contains the value
    public boolean matches(double value) {
        return range.contains(value);
    }
}

package io.aim.core.classify;

import io.aim.core.metric.model.Icon;
import io.aim.core.metric.model.ScoreBand;

/// Qualitative assessment of one numeric result value.
///
/// @param bandId id of the matching score band
/// @param label judgment label (e.g. `"good"`)
/// @param description text shown with the judgment
/// @param icon presentation icon, never null
public record Judgment(String bandId, String label, String description, Icon icon) {

    /// Creates the judgment expressed by a band.
    ///
    /// @param band the matching band, not null
    /// @return the judgment, never null
    public static Judgment of(ScoreBand band) {
        return new Judgment(band.id(), band.judgment(), band.description(), band.icon());
    }
}

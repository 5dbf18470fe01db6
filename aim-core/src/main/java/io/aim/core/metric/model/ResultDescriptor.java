package io.aim.core.metric.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Declaration of one value produced by a metric.
///
/// A metric producing `N` values declares `N` result descriptors whose
/// indices are exactly `0..N-1`. Numeric results carry the score bands used
/// to classify them; image results usually carry none.
///
/// @param id result identifier (e.g. `"m1_0"`), not null
/// @param index zero-based position of the value in the evaluator's output
/// @param valueType declared value type, not null
/// @param name display name, not null
/// @param description optional explanatory text, may be null
/// @param bands score bands in evaluation order, never null (may be empty)
public record ResultDescriptor(
        String id,
        int index,
        ValueType valueType,
        String name,
        String description,
        List<ScoreBand> bands) {

    public ResultDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        Objects.requireNonNull(name, "name must not be null");
        bands = bands != null ? List.copyOf(bands) : List.of();
    }

    /// Returns the description, if the document declares one.
    ///
    /// @return the description, or empty
    public Optional<String> findDescription() {
        return Optional.ofNullable(description);
    }
}

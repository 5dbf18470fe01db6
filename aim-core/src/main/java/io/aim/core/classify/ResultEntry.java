package io.aim.core.classify;

import io.aim.core.evaluator.ResultValue;
import java.util.Objects;
import java.util.Optional;

/// One classified value of a metric result.
///
/// @param resultId declared result id, not null
/// @param index declared result index
/// @param value the raw value, not null
/// @param judgment the matching judgment, or `null` when none applies
public record ResultEntry(String resultId, int index, ResultValue value, Judgment judgment) {

    public ResultEntry {
        Objects.requireNonNull(resultId, "resultId must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public Optional<Judgment> findJudgment() {
        return Optional.ofNullable(judgment);
    }
}

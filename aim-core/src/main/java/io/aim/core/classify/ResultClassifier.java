package io.aim.core.classify;

import io.aim.core.evaluator.ResultValue;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ScoreBand;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/// Maps raw numeric values to qualitative judgments.
///
/// Implementations must be deterministic: the same value and bands always
/// yield the same judgment.
///
/// @see ScoreBandClassifier
@FunctionalInterface
public interface ResultClassifier {

    /// Classifies a value against an ordered list of bands.
    ///
    /// @param value raw value
    /// @param bands bands in declared order, not null
    /// @return the judgment, or empty if no band applies
    Optional<Judgment> classify(double value, List<ScoreBand> bands);

    /// Classifies one value against its result declaration.
    ///
    /// Image values are never classified.
    ///
    /// @param value raw value, not null
    /// @param result the value's declaration, not null
    /// @return the judgment, or empty
    default Optional<Judgment> classify(ResultValue value, ResultDescriptor result) {
        OptionalDouble numeric = value.numeric();
        if (numeric.isEmpty()) {
            return Optional.empty();
        }
        return classify(numeric.getAsDouble(), result.bands());
    }

    /// Classifies a metric's complete output.
    ///
    /// @param metric the metric's declaration, not null
    /// @param values values in index order, matching the declared shape, not null
    /// @return one entry per value, in index order, never null
    default List<ResultEntry> classifyAll(MetricDescriptor metric, List<ResultValue> values) {
        List<ResultDescriptor> declared = metric.getResultsByIndex();
        List<ResultEntry> entries = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            ResultDescriptor result = declared.get(i);
            ResultValue value = values.get(i);
            Judgment judgment = classify(value, result).orElse(null);
            entries.add(new ResultEntry(result.id(), result.index(), value, judgment));
        }
        return List.copyOf(entries);
    }
}

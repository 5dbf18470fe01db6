package io.aim.core.evaluator;

import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ValueType;
import java.util.ArrayList;
import java.util.List;

/// Checks evaluator output against the metric's declared results.
///
/// The only coercion performed is widening an {@link ResultValue.IntegerValue}
/// to a {@link ResultValue.FloatValue} where a float is declared. Anything
/// else that does not match is a computation failure.
public final class ResultShapeValidator {

    private ResultShapeValidator() {}

    /// Validates and normalizes evaluator output.
    ///
    /// @param metric the metric's declaration, not null
    /// @param values the evaluator output, may be null
    /// @return values in index order, widened where needed, never null
    /// @throws EvaluationException with kind `COMPUTATION_FAILURE` on any mismatch
    public static List<ResultValue> conform(MetricDescriptor metric, List<ResultValue> values)
            throws EvaluationException {
        if (values == null) {
            throw EvaluationException.computationFailure(
                    "Metric '" + metric.getId() + "' returned no values");
        }
        List<ResultDescriptor> declared = metric.getResultsByIndex();
        if (values.size() != declared.size()) {
            throw EvaluationException.computationFailure(
                    "Metric '"
                            + metric.getId()
                            + "' returned "
                            + values.size()
                            + " values, expected "
                            + declared.size());
        }

        List<ResultValue> conformed = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            ResultValue value = values.get(i);
            ResultDescriptor result = declared.get(i);
            if (value == null) {
                throw EvaluationException.computationFailure(
                        "Metric '" + metric.getId() + "' returned null for " + result.id());
            }
            conformed.add(conform(metric.getId(), result, value));
        }
        return conformed;
    }

    private static ResultValue conform(String metricId, ResultDescriptor result, ResultValue value)
            throws EvaluationException {
        if (value.type() == result.valueType()) {
            return value;
        }
        if (result.valueType() == ValueType.FLOAT
                && value instanceof ResultValue.IntegerValue integer) {
            return ResultValue.of((double) integer.value());
        }
        throw EvaluationException.computationFailure(
                "Metric '"
                        + metricId
                        + "' returned "
                        + value.type()
                        + " for "
                        + result.id()
                        + ", declared "
                        + result.valueType());
    }
}

package io.aim.core.evaluator;

import io.aim.core.artifact.ResolvedArtifact;
import java.util.List;

/// Computation behind one metric.
///
/// ### Contracts
/// - **Purity**: must not modify the artifact or any state shared with other evaluators
/// - **Determinism**: identical bytes always produce identical values
/// - **Shape**: returns exactly the declared number of values, in index order,
///   each of the declared type; an integer may stand in for a declared float
///
/// Evaluators are invoked concurrently from the dispatcher's worker pool and
/// must be thread-safe. A call may be abandoned after the task timeout; the
/// thread is interrupted but the result is discarded either way.
///
/// @see io.aim.core.evaluator.spi.EvaluatorProvider
/// @see ResultShapeValidator
public interface MetricEvaluator {

    /// Returns the id of the metric this evaluator computes.
    ///
    /// @return registry metric id, never null
    String getMetricId();

    /// Computes the metric's values for an artifact.
    ///
    /// @param artifact the artifact bytes, not null
    /// @return values in result-index order, never null
    /// @throws EvaluationException if the values cannot be produced
    List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException;
}

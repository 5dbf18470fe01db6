package io.aim.core.evaluator;

import java.util.Optional;
import java.util.Set;

/// Lookup of metric evaluators by metric id.
///
/// @implNote Implementations must be safe for concurrent reads.
///
/// @see DefaultEvaluatorRegistry
public interface EvaluatorRegistry {

    /// @param metricId registry metric id, not null
    /// @return the evaluator, or empty if none is registered
    Optional<MetricEvaluator> getEvaluator(String metricId);

    boolean hasEvaluator(String metricId);

    /// @return ids of all metrics with an evaluator, never null
    Set<String> getMetricIds();
}

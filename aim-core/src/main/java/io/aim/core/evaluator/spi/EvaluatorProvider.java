package io.aim.core.evaluator.spi;

import io.aim.core.evaluator.MetricEvaluator;
import java.util.List;

/// Provider interface for pluggable metric implementations.
///
/// Implementations are discovered from
/// `META-INF/services/io.aim.core.evaluator.spi.EvaluatorProvider` or passed
/// explicitly to {@link io.aim.core.AimFactory.Builder#evaluatorProviders(List)}.
///
/// ### Priority System
/// When several providers supply an evaluator for the same metric id, the
/// provider with the highest {@link #getPriority()} wins. Use this to replace
/// a built-in metric with a custom implementation.
///
/// @implNote Implementations should be stateless. Evaluators are created once
/// at environment startup and shared by all sessions.
public interface EvaluatorProvider {

    /// Returns the provider's display name for logging.
    ///
    /// @return provider name, never null
    String getName();

    /// Creates the evaluators this provider contributes.
    ///
    /// @return evaluators, never null (may be empty)
    List<MetricEvaluator> createEvaluators();

    /// Returns this provider's priority.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}

package io.aim.core.execution;

import io.aim.core.classify.ResultEntry;
import io.aim.core.evaluator.EvaluationException;
import java.util.List;
import java.util.Objects;

/// Result of one {@link EvaluationTask}.
public sealed interface TaskOutcome permits TaskOutcome.Success, TaskOutcome.Failure {

    String metricId();

    /// The metric produced values matching its declaration.
    ///
    /// @param metricId the metric
    /// @param entries classified values in index order
    record Success(String metricId, List<ResultEntry> entries) implements TaskOutcome {
        public Success {
            Objects.requireNonNull(metricId, "metricId must not be null");
            entries = List.copyOf(entries);
        }
    }

    /// The metric failed; the failure is isolated to it.
    ///
    /// @param metricId the metric
    /// @param kind failure category
    /// @param reason human readable description
    record Failure(String metricId, EvaluationException.Kind kind, String reason)
            implements TaskOutcome {
        public Failure {
            Objects.requireNonNull(metricId, "metricId must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }
}

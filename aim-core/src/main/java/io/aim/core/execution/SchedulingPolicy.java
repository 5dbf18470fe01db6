package io.aim.core.execution;

import java.util.Comparator;

/// Order in which queued tasks are handed to free workers.
///
/// Ordering is best effort: it only applies to tasks waiting in the queue,
/// never to tasks already running.
public enum SchedulingPolicy {
    /// Fastest declared speed first; ties broken by submission order.
    SPEED_FIRST(
            Comparator.comparingInt((EvaluationTask task) -> -task.getSpeed().getRating())
                    .thenComparingLong(EvaluationTask::getSequence)),

    /// Strict submission order, which within a session is registration order.
    REGISTRATION_ORDER(Comparator.comparingLong(EvaluationTask::getSequence));

    private final Comparator<EvaluationTask> comparator;

    SchedulingPolicy(Comparator<EvaluationTask> comparator) {
        this.comparator = comparator;
    }

    public Comparator<EvaluationTask> comparator() {
        return comparator;
    }
}

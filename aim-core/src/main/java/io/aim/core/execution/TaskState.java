package io.aim.core.execution;

/// Lifecycle of an {@link EvaluationTask}.
///
/// `PENDING -> RUNNING -> COMPLETED`, or `PENDING -> DROPPED` when the
/// session is cancelled before the task starts.
public enum TaskState {
    /// Queued, waiting for a worker.
    PENDING,

    /// Evaluator invoked; waiting for values or the timeout.
    RUNNING,

    /// Outcome reported to the session (success or failure).
    COMPLETED,

    /// Discarded without running because its session was cancelled.
    DROPPED
}

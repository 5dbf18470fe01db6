package io.aim.core.execution;

import io.aim.core.session.EvaluationEvent;
import io.aim.core.session.EvaluationSession;
import java.time.Duration;

/// Listener for evaluation lifecycle events.
///
/// Provides hooks for logging and monitoring. All methods have no-op
/// defaults, so implementations override only what they need.
///
/// ### Callback Lifecycle
/// ```
/// onSessionRejected(id, event)      - request refused, nothing else follows
///   - OR -
/// onSessionStart(session)           - tasks are about to be queued
/// onTaskStart(id, metricId)         - a worker picked up a task (per metric)
/// onTaskComplete(id, outcome, time) - the task produced an outcome (per metric)
/// onSessionComplete(session)        - every metric reported
/// ```
///
/// @implNote Task callbacks arrive concurrently from worker threads.
public interface EvaluationListener {

    /// Listener that ignores every callback.
    EvaluationListener NOOP = new EvaluationListener() {};

    default void onSessionStart(EvaluationSession session) {}

    default void onTaskStart(String sessionId, String metricId) {}

    /// Called when a task has an outcome, before the session records it.
    ///
    /// @param sessionId owning session, not null
    /// @param outcome success or failure, not null
    /// @param elapsed wall time from task start, not null
    default void onTaskComplete(String sessionId, TaskOutcome outcome, Duration elapsed) {}

    default void onSessionComplete(EvaluationSession session) {}

    /// Called when a request is refused before any task is scheduled.
    ///
    /// @param sessionId the requested session id, not null
    /// @param event the `ValidationError` or `GeneralError` delivered to the sink, not null
    default void onSessionRejected(String sessionId, EvaluationEvent event) {}

    /// Called when a session is cancelled before completing.
    default void onSessionCancelled(EvaluationSession session) {}
}

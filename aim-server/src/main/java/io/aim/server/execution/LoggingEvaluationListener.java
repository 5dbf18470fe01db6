package io.aim.server.execution;

import io.aim.core.execution.EvaluationListener;
import io.aim.core.execution.TaskOutcome;
import io.aim.core.session.EvaluationEvent;
import io.aim.core.session.EvaluationSession;
import io.aim.server.validation.LogSanitizer;
import java.time.Duration;
import org.jboss.logging.Logger;

/// Logs the lifecycle of every evaluation session.
///
/// ### Log Format
/// ```
/// [sessionId] started: N metrics
/// [sessionId] m13 OK in 42 ms
/// [sessionId] m23 TIMEOUT in 60000 ms: Metric did not finish within 60000 ms
/// [sessionId] complete: N/N metrics
/// ```
///
/// Session lifecycle goes to INFO, per-metric successes to DEBUG and
/// per-metric failures to WARN.
///
/// @implNote Thread-safe. Task callbacks arrive concurrently from worker
/// threads; lines of different sessions may interleave.
///
/// @see CompositeEvaluationListener
public class LoggingEvaluationListener implements EvaluationListener {

    private static final Logger LOG = Logger.getLogger(LoggingEvaluationListener.class);

    @Override
    public void onSessionStart(EvaluationSession session) {
        LOG.infov(
                "[{0}] started: {1} metrics",
                LogSanitizer.sanitize(session.getId()), session.getSubmittedCount());
    }

    @Override
    public void onTaskStart(String sessionId, String metricId) {
        LOG.tracev("[{0}] {1} running", LogSanitizer.sanitize(sessionId), metricId);
    }

    @Override
    public void onTaskComplete(String sessionId, TaskOutcome outcome, Duration elapsed) {
        String id = LogSanitizer.sanitize(sessionId);
        if (outcome instanceof TaskOutcome.Failure failure) {
            LOG.warnv(
                    "[{0}] {1} {2} in {3} ms: {4}",
                    id, failure.metricId(), failure.kind(), elapsed.toMillis(), failure.reason());
        } else {
            LOG.debugv("[{0}] {1} OK in {2} ms", id, outcome.metricId(), elapsed.toMillis());
        }
    }

    @Override
    public void onSessionComplete(EvaluationSession session) {
        LOG.infov(
                "[{0}] complete: {1}/{2} metrics",
                LogSanitizer.sanitize(session.getId()),
                session.getCompletedCount(),
                session.getSubmittedCount());
    }

    @Override
    public void onSessionRejected(String sessionId, EvaluationEvent event) {
        LOG.infov(
                "[{0}] rejected ({1}): {2}",
                LogSanitizer.sanitize(sessionId), event.action(), LogSanitizer.sanitize(message(event)));
    }

    @Override
    public void onSessionCancelled(EvaluationSession session) {
        LOG.infov(
                "[{0}] cancelled after {1}/{2} metrics",
                LogSanitizer.sanitize(session.getId()),
                session.getCompletedCount(),
                session.getSubmittedCount());
    }

    private static String message(EvaluationEvent event) {
        if (event instanceof EvaluationEvent.ValidationError error) {
            return error.message();
        }
        if (event instanceof EvaluationEvent.GeneralError error) {
            return error.message();
        }
        return event.type();
    }
}

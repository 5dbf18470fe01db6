package io.aim.core.session;

import io.aim.core.classify.ResultEntry;
import io.aim.core.evaluator.EvaluationException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Events delivered to a session's {@link EvaluationEventSink}.
///
/// ### Ordering
/// A session emits either exactly one rejection ({@link ValidationError} or
/// {@link GeneralError}) and nothing else, or zero or more
/// {@link MetricResult}s followed by exactly one {@link SessionComplete}.
/// A cancelled session stops emitting.
///
/// ### Event Types
/// - `result` / `pushResult` - one metric finished, successfully or not
/// - `error` / `pushValidationError` - the request was rejected before scheduling
/// - `error` / `pushGeneralError` - the artifact could not be obtained or scheduling failed
/// - `complete` / `sessionComplete` - every requested metric has reported
public sealed interface EvaluationEvent {

    /// Returns the event category.
    ///
    /// @return `"result"`, `"error"` or `"complete"`, never null
    String type();

    /// Returns the client-side action this event triggers.
    ///
    /// @return action name, never null
    String action();

    String sessionId();

    Instant timestamp();

    /// Returns whether no further events follow this one.
    ///
    /// @return `true` for rejections and completion
    default boolean isTerminal() {
        return true;
    }

    /// Outcome of one metric.
    ///
    /// A failed metric carries an empty result list plus the failure kind and message.
    ///
    /// @param sessionId owning session
    /// @param metricId the metric that finished
    /// @param results classified values in index order, empty on failure
    /// @param failureKind failure category, or `null` on success
    /// @param failureMessage failure description, or `null` on success
    /// @param timestamp emission time
    record MetricResult(
            String sessionId,
            String metricId,
            List<ResultEntry> results,
            EvaluationException.Kind failureKind,
            String failureMessage,
            Instant timestamp)
            implements EvaluationEvent {

        public MetricResult {
            Objects.requireNonNull(metricId, "metricId must not be null");
            results = List.copyOf(results);
        }

        public static MetricResult success(
                String sessionId, String metricId, List<ResultEntry> results) {
            return new MetricResult(sessionId, metricId, results, null, null, Instant.now());
        }

        public static MetricResult failure(
                String sessionId, String metricId, EvaluationException.Kind kind, String message) {
            return new MetricResult(sessionId, metricId, List.of(), kind, message, Instant.now());
        }

        public boolean isFailure() {
            return failureKind != null;
        }

        @Override
        public String type() {
            return "result";
        }

        @Override
        public String action() {
            return "pushResult";
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    /// The request was rejected; lists every problem found.
    record ValidationError(String sessionId, String message, Instant timestamp)
            implements EvaluationEvent {

        public static ValidationError of(String sessionId, List<String> problems) {
            return new ValidationError(sessionId, String.join("; ", problems), Instant.now());
        }

        @Override
        public String type() {
            return "error";
        }

        @Override
        public String action() {
            return "pushValidationError";
        }
    }

    /// The request could not be processed for reasons other than its content.
    record GeneralError(String sessionId, String message, Instant timestamp)
            implements EvaluationEvent {

        public static GeneralError of(String sessionId, String message) {
            return new GeneralError(sessionId, message, Instant.now());
        }

        @Override
        public String type() {
            return "error";
        }

        @Override
        public String action() {
            return "pushGeneralError";
        }
    }

    /// Every requested metric has reported.
    record SessionComplete(String sessionId, Instant timestamp) implements EvaluationEvent {

        public static SessionComplete now(String sessionId) {
            return new SessionComplete(sessionId, Instant.now());
        }

        @Override
        public String type() {
            return "complete";
        }

        @Override
        public String action() {
            return "sessionComplete";
        }
    }
}

package io.aim.core.session;

/// Receiver of a session's events.
///
/// Calls for one session never overlap, but may arrive on different threads.
/// Exceptions thrown by a sink are logged and do not affect the session.
@FunctionalInterface
public interface EvaluationEventSink {

    void accept(EvaluationEvent event);
}

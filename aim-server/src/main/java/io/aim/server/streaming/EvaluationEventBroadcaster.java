package io.aim.server.streaming;

import io.aim.core.session.EvaluationEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.UnicastProcessor;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Streams evaluation events to the client of each session.
///
/// Each session gets one {@link UnicastProcessor}, opened before the request
/// is submitted. The processor buffers events until its subscriber arrives, so
/// a rejection delivered synchronously by the dispatcher is never lost.
///
/// ### Stream Lifecycle
/// - {@link #open(String, Runnable)} registers the stream
/// - {@link #publish(EvaluationEvent)} forwards events; the terminal event
///   completes the stream and releases it
/// - a subscriber cancelling before the terminal event triggers the
///   cancellation callback given to `open`, then releases the stream
///
/// ### Thread Safety
/// Thread-safe. Events of one session are published by a single writer at a
/// time; streams of different sessions are independent.
///
/// ### Usage
/// {@snippet :
/// Multi<EvaluationEvent> events =
///         broadcaster.open(sessionId, () -> dispatcher.cancel(sessionId));
/// dispatcher.submit(request, broadcaster::publish);
/// }
///
/// @implNote Streams are unicast. A second subscriber to the same stream
/// receives an error.
@ApplicationScoped
public class EvaluationEventBroadcaster {

    private static final Logger LOG = Logger.getLogger(EvaluationEventBroadcaster.class);

    private final Map<String, UnicastProcessor<EvaluationEvent>> processors =
            new ConcurrentHashMap<>();

    /// Opens the event stream of a session.
    ///
    /// @param sessionId the session, not null
    /// @param onCancel invoked when the subscriber cancels before the terminal event, not null
    /// @return the session's event stream, never null
    /// @throws IllegalStateException if a stream is already open for the session
    public Multi<EvaluationEvent> open(String sessionId, Runnable onCancel) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(onCancel, "onCancel must not be null");

        UnicastProcessor<EvaluationEvent> processor = UnicastProcessor.create();
        if (processors.putIfAbsent(sessionId, processor) != null) {
            throw new IllegalStateException("Stream already open for session " + sessionId);
        }
        LOG.debugv("Opened event stream for session: {0}", sessionId);

        return processor
                .onCancellation()
                .invoke(
                        () -> {
                            if (processors.remove(sessionId, processor)) {
                                LOG.debugv("Client disconnected from session: {0}", sessionId);
                                onCancel.run();
                            }
                        });
    }

    /// Forwards an event to its session's stream.
    ///
    /// Usable directly as an {@link io.aim.core.session.EvaluationEventSink}.
    ///
    /// @param event the event, not null
    public void publish(EvaluationEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String sessionId = event.sessionId();

        UnicastProcessor<EvaluationEvent> processor =
                event.isTerminal() ? processors.remove(sessionId) : processors.get(sessionId);
        if (processor == null) {
            LOG.tracev("No stream for session {0}, {1} event dropped", sessionId, event.type());
            return;
        }
        LOG.debugv("Publishing {0} to session {1}", event.action(), sessionId);
        processor.onNext(event);
        if (event.isTerminal()) {
            processor.onComplete();
        }
    }

    /// Releases a session's stream, completing it without a terminal event.
    ///
    /// @param sessionId the session, not null
    public void close(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        UnicastProcessor<EvaluationEvent> processor = processors.remove(sessionId);
        if (processor != null) {
            LOG.debugv("Closing event stream for session: {0}", sessionId);
            processor.onComplete();
        }
    }

    public boolean hasStream(String sessionId) {
        return processors.containsKey(sessionId);
    }

    /// @return number of streams awaiting their terminal event
    public int activeStreamCount() {
        return processors.size();
    }
}

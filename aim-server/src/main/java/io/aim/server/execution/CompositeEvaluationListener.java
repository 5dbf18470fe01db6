package io.aim.server.execution;

import io.aim.core.execution.EvaluationListener;
import io.aim.core.execution.TaskOutcome;
import io.aim.core.session.EvaluationEvent;
import io.aim.core.session.EvaluationSession;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/// Fans out evaluation lifecycle callbacks to an ordered list of delegates.
///
/// Delegates are invoked in declaration order. An exception from one delegate
/// is logged and does not prevent the remaining delegates from receiving the
/// callback.
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are
/// captured at construction and never mutated.
public final class CompositeEvaluationListener implements EvaluationListener {

    private static final Logger LOG = Logger.getLogger(CompositeEvaluationListener.class);

    private final List<EvaluationListener> delegates;

    /// @param delegates listeners to notify in order; must not be null, elements must not be null
    public CompositeEvaluationListener(List<EvaluationListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public CompositeEvaluationListener(EvaluationListener... delegates) {
        this(List.of(delegates));
    }

    @Override
    public void onSessionStart(EvaluationSession session) {
        forEach(d -> d.onSessionStart(session));
    }

    @Override
    public void onTaskStart(String sessionId, String metricId) {
        forEach(d -> d.onTaskStart(sessionId, metricId));
    }

    @Override
    public void onTaskComplete(String sessionId, TaskOutcome outcome, Duration elapsed) {
        forEach(d -> d.onTaskComplete(sessionId, outcome, elapsed));
    }

    @Override
    public void onSessionComplete(EvaluationSession session) {
        forEach(d -> d.onSessionComplete(session));
    }

    @Override
    public void onSessionRejected(String sessionId, EvaluationEvent event) {
        forEach(d -> d.onSessionRejected(sessionId, event));
    }

    @Override
    public void onSessionCancelled(EvaluationSession session) {
        forEach(d -> d.onSessionCancelled(session));
    }

    private void forEach(Consumer<EvaluationListener> callback) {
        for (EvaluationListener delegate : delegates) {
            try {
                callback.accept(delegate);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Listener {0} failed", delegate.getClass().getName());
            }
        }
    }
}

package io.aim.core.session;

import io.aim.core.execution.TaskOutcome;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Aggregates the outcomes of one evaluation request into an ordered event stream.
///
/// Workers hand finished outcomes to {@link #report(TaskOutcome)}, which
/// appends them to a lock-free mailbox. Whichever reporting thread finds the
/// mailbox idle becomes the drainer and applies queued outcomes one at a
/// time until the mailbox is empty, so session state has exactly one writer
/// at any moment and no lock is held while evaluators run.
///
/// ### Contracts
/// - **Invariant**: `0 <= completedCount <= submittedCount`
/// - **Invariant**: at most one `SessionComplete` is emitted, after every
///   requested metric has reported
/// - **Invariant**: a rejected session emits its rejection and nothing else
/// - **Postcondition**: after {@link #cancel()} no further events are emitted,
///   except one already being delivered by a concurrent drainer
///
/// Sessions are created by {@link io.aim.core.execution.EvaluationDispatcher};
/// they are never shared between requests.
public final class EvaluationSession {

    private static final Logger logger = Logger.getLogger(EvaluationSession.class.getName());

    /// Callbacks from a session to its owner.
    public interface Hooks {

        Hooks NONE = new Hooks() {};

        /// Called once, after `SessionComplete` has been delivered.
        default void onComplete(EvaluationSession session) {}

        /// Called once, when the session is cancelled before completing.
        default void onCancel(EvaluationSession session) {}
    }

    private final String id;
    private final Set<String> metricIds;
    private final EvaluationEventSink sink;
    private final Hooks hooks;
    private final Instant createdAt = Instant.now();

    private final Queue<TaskOutcome> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private final Map<String, TaskOutcome> results = new ConcurrentHashMap<>();
    private final AtomicBoolean terminal = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile boolean rejected;
    private volatile boolean completed;
    private volatile int completedCount;

    /// Creates a session expecting one outcome per metric id.
    ///
    /// @param id session correlation id, not null
    /// @param metricIds distinct requested metric ids, not null (may be empty)
    /// @param sink receiver of the session's events, not null
    /// @param hooks owner callbacks, not null
    public EvaluationSession(
            String id, List<String> metricIds, EvaluationEventSink sink, Hooks hooks) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.metricIds = Collections.unmodifiableSet(new LinkedHashSet<>(metricIds));
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
    }

    /// Creates a session that has already been refused.
    ///
    /// The rejection is delivered to the sink before this method returns.
    ///
    /// @param id session correlation id, not null
    /// @param rejection the `ValidationError` or `GeneralError`, not null
    /// @param sink receiver of the rejection, not null
    /// @return a terminal session with nothing submitted, never null
    public static EvaluationSession rejected(
            String id, EvaluationEvent rejection, EvaluationEventSink sink) {
        EvaluationSession session = new EvaluationSession(id, List.of(), sink, Hooks.NONE);
        session.rejected = true;
        session.terminal.set(true);
        session.deliver(rejection);
        return session;
    }

    /// Completes immediately if nothing was requested.
    ///
    /// Called by the dispatcher once the session is registered.
    public void start() {
        if (metricIds.isEmpty()) {
            complete();
        }
    }

    /// Records a task outcome and emits the corresponding events.
    ///
    /// Safe to call from any thread. Outcomes arriving after cancellation or
    /// for metrics that already reported are discarded.
    ///
    /// @param outcome the outcome, not null
    public void report(TaskOutcome outcome) {
        mailbox.offer(Objects.requireNonNull(outcome, "outcome must not be null"));
        drain();
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            TaskOutcome outcome;
            while ((outcome = mailbox.poll()) != null) {
                apply(outcome);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void apply(TaskOutcome outcome) {
        if (cancelled || terminal.get()) {
            logger.fine("Discarding outcome of '" + outcome.metricId() + "' for closed session " + id);
            return;
        }
        String metricId = outcome.metricId();
        if (!metricIds.contains(metricId) || results.containsKey(metricId)) {
            logger.warning("Ignoring unexpected outcome for metric '" + metricId + "' in session " + id);
            return;
        }
        results.put(metricId, outcome);
        completedCount = completedCount + 1;
        deliver(toEvent(outcome));
        if (completedCount == metricIds.size()) {
            complete();
        }
    }

    private EvaluationEvent toEvent(TaskOutcome outcome) {
        if (outcome instanceof TaskOutcome.Success success) {
            return EvaluationEvent.MetricResult.success(id, success.metricId(), success.entries());
        }
        TaskOutcome.Failure failure = (TaskOutcome.Failure) outcome;
        return EvaluationEvent.MetricResult.failure(
                id, failure.metricId(), failure.kind(), failure.reason());
    }

    private void complete() {
        if (cancelled || !terminal.compareAndSet(false, true)) {
            return;
        }
        completed = true;
        deliver(EvaluationEvent.SessionComplete.now(id));
        hooks.onComplete(this);
    }

    private void deliver(EvaluationEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Event sink failed for session " + id + " on " + event.action(),
                    e);
        }
    }

    /// Cancels the session.
    ///
    /// Queued tasks are dropped by the owner; outcomes of running tasks are
    /// discarded when they arrive.
    ///
    /// @return `true` if this call cancelled the session, `false` if it was
    ///         already complete, rejected or cancelled
    public boolean cancel() {
        if (!terminal.compareAndSet(false, true)) {
            return false;
        }
        cancelled = true;
        logger.fine("Session " + id + " cancelled after " + completedCount + " of "
                + metricIds.size() + " metrics");
        hooks.onCancel(this);
        return true;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /// @return number of metrics scheduled for this session
    public int getSubmittedCount() {
        return metricIds.size();
    }

    /// @return number of metrics that have reported so far
    public int getCompletedCount() {
        return completedCount;
    }

    /// @return distinct requested metric ids, never null
    public Set<String> getMetricIds() {
        return metricIds;
    }

    /// Returns a snapshot of the outcomes recorded so far.
    ///
    /// @return copy of the outcomes by metric id, never null
    public Map<String, TaskOutcome> getResults() {
        return new HashMap<>(results);
    }

    public Optional<TaskOutcome> getOutcome(String metricId) {
        return Optional.ofNullable(results.get(metricId));
    }

    /// @return `true` once the session completed, was rejected or was cancelled
    public boolean isTerminal() {
        return terminal.get();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isRejected() {
        return rejected;
    }

    /// @return `true` if every requested metric reported and completion was emitted
    public boolean isComplete() {
        return completed;
    }

    @Override
    public String toString() {
        return "EvaluationSession{id='" + id + "', completed=" + completedCount + "/"
                + metricIds.size() + ", terminal=" + terminal.get() + "}";
    }
}

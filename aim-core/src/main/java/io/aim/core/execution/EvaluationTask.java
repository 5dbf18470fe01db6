package io.aim.core.execution;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultShapeValidator;
import io.aim.core.evaluator.ResultValue;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.Speed;
import io.aim.core.session.EvaluationSession;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/// One metric's unit of work within a session.
///
/// Runs on a dispatcher worker: hands the evaluator call to the evaluator
/// pool, waits at most the configured timeout, checks the output shape,
/// classifies numeric values and reports the outcome to the session. Every
/// failure along the way becomes a {@link TaskOutcome.Failure}; nothing
/// escapes this boundary.
///
/// Tasks are ordered in the worker queue by the dispatcher's
/// {@link SchedulingPolicy}.
public final class EvaluationTask implements Runnable, Comparable<EvaluationTask> {

    private static final Logger logger = Logger.getLogger(EvaluationTask.class.getName());

    private final EvaluationSession session;
    private final MetricDescriptor metric;
    private final MetricEvaluator evaluator;
    private final ResolvedArtifact artifact;
    private final long sequence;
    private final SchedulingPolicy policy;
    private final TaskContext context;
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);

    EvaluationTask(
            EvaluationSession session,
            MetricDescriptor metric,
            MetricEvaluator evaluator,
            ResolvedArtifact artifact,
            long sequence,
            SchedulingPolicy policy,
            TaskContext context) {
        this.session = session;
        this.metric = metric;
        this.evaluator = evaluator;
        this.artifact = artifact;
        this.sequence = sequence;
        this.policy = policy;
        this.context = context;
    }

    @Override
    public void run() {
        if (session.isCancelled()) {
            drop();
            return;
        }
        if (!state.compareAndSet(TaskState.PENDING, TaskState.RUNNING)) {
            return;
        }
        context.listener().onTaskStart(session.getId(), metric.getId());
        long startedAt = System.nanoTime();

        TaskOutcome outcome = evaluate();

        state.set(TaskState.COMPLETED);
        context.listener()
                .onTaskComplete(
                        session.getId(), outcome, Duration.ofNanos(System.nanoTime() - startedAt));
        session.report(outcome);
    }

    private TaskOutcome evaluate() {
        Future<List<ResultValue>> future;
        try {
            future = context.evaluatorPool().submit(() -> evaluator.evaluate(artifact));
        } catch (RejectedExecutionException e) {
            return failure(EvaluationException.Kind.COMPUTATION_FAILURE, "Evaluator pool is shut down");
        }

        try {
            List<ResultValue> raw = future.get(context.timeout().toMillis(), TimeUnit.MILLISECONDS);
            List<ResultValue> values = ResultShapeValidator.conform(metric, raw);
            return new TaskOutcome.Success(
                    metric.getId(), context.classifier().classifyAll(metric, values));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning(
                    "Metric '"
                            + metric.getId()
                            + "' timed out after "
                            + context.timeout().toMillis()
                            + "ms in session "
                            + session.getId());
            return failure(
                    EvaluationException.Kind.TIMEOUT,
                    "Metric did not finish within " + context.timeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            return fromEvaluatorFailure(e.getCause());
        } catch (EvaluationException e) {
            logger.warning("Metric '" + metric.getId() + "' output rejected: " + e.getMessage());
            return failure(e.getKind(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failure(EvaluationException.Kind.COMPUTATION_FAILURE, "Evaluation interrupted");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to classify metric '" + metric.getId() + "'", e);
            return failure(EvaluationException.Kind.COMPUTATION_FAILURE, describe(e));
        }
    }

    private TaskOutcome fromEvaluatorFailure(Throwable cause) {
        if (cause instanceof EvaluationException evaluationException) {
            logger.warning(
                    "Metric '"
                            + metric.getId()
                            + "' failed ("
                            + evaluationException.getKind()
                            + "): "
                            + evaluationException.getMessage());
            return failure(evaluationException.getKind(), evaluationException.getMessage());
        }
        logger.log(Level.WARNING, "Metric '" + metric.getId() + "' threw unexpectedly", cause);
        return failure(EvaluationException.Kind.COMPUTATION_FAILURE, describe(cause));
    }

    private TaskOutcome failure(EvaluationException.Kind kind, String reason) {
        return new TaskOutcome.Failure(metric.getId(), kind, reason);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null
                ? error.getClass().getSimpleName() + ": " + message
                : error.getClass().getSimpleName();
    }

    /// Marks the task as dropped if it has not started.
    ///
    /// @return `true` if the task will not run
    boolean drop() {
        return state.compareAndSet(TaskState.PENDING, TaskState.DROPPED)
                || state.get() == TaskState.DROPPED;
    }

    public String getMetricId() {
        return metric.getId();
    }

    public String getSessionId() {
        return session.getId();
    }

    public Speed getSpeed() {
        return metric.getSpeed();
    }

    /// @return dispatcher-wide submission order
    public long getSequence() {
        return sequence;
    }

    public TaskState getState() {
        return state.get();
    }

    @Override
    public int compareTo(EvaluationTask other) {
        return policy.comparator().compare(this, other);
    }

    @Override
    public String toString() {
        return "EvaluationTask{session='" + session.getId() + "', metric='" + metric.getId()
                + "', state=" + state.get() + "}";
    }
}

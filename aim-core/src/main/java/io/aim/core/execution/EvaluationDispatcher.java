package io.aim.core.execution;

import io.aim.core.AimConfig;
import io.aim.core.artifact.ArtifactResolver;
import io.aim.core.artifact.ArtifactValidator;
import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.classify.ResultClassifier;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.EvaluatorRegistry;
import io.aim.core.exception.ArtifactUnavailableException;
import io.aim.core.metric.MetricRegistry;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.session.EvaluationEvent;
import io.aim.core.session.EvaluationEventSink;
import io.aim.core.session.EvaluationSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Validates evaluation requests and schedules one task per requested metric.
///
/// ### Request Flow
/// 1. Resolve the artifact; failure rejects the request with `GeneralError`
/// 2. Check every metric id against the registry and the evaluator registry,
///    check the artifact, check the session id is not already active; any
///    problem rejects the request with a single `ValidationError`
/// 3. Deduplicate metric ids, keeping first-occurrence order
/// 4. Create the session; an empty request completes at once
/// 5. Queue one {@link EvaluationTask} per metric on the bounded worker pool
///
/// Tasks run concurrently on at most `workerPoolSize` workers. Each worker
/// waits at most `taskTimeout` for its evaluator; a call that overruns keeps
/// running on the unbounded evaluator pool while the worker moves on.
///
/// @implNote Thread-safe. Sessions are owned by the dispatcher and tracked
/// by id only while active.
///
/// @see EvaluationSession
/// @see SchedulingPolicy
public class EvaluationDispatcher implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(EvaluationDispatcher.class.getName());

    private final MetricRegistry metricRegistry;
    private final EvaluatorRegistry evaluatorRegistry;
    private final ArtifactResolver artifactResolver;
    private final ArtifactValidator artifactValidator;
    private final SchedulingPolicy schedulingPolicy;
    private final EvaluationListener listener;
    private final ThreadPoolExecutor workerPool;
    private final ExecutorService evaluatorPool;
    private final TaskContext taskContext;

    private final Map<String, EvaluationSession> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, List<EvaluationTask>> sessionTasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /// Creates a dispatcher with its own worker and evaluator pools.
    ///
    /// @param metricRegistry validated metric registry, not null
    /// @param evaluatorRegistry evaluators by metric id, not null
    /// @param classifier judgment classifier, not null
    /// @param artifactResolver artifact resolver, not null
    /// @param config pool size, timeout and artifact limits, not null
    /// @param listener lifecycle callbacks, not null (use {@link EvaluationListener#NOOP})
    public EvaluationDispatcher(
            MetricRegistry metricRegistry,
            EvaluatorRegistry evaluatorRegistry,
            ResultClassifier classifier,
            ArtifactResolver artifactResolver,
            AimConfig config,
            EvaluationListener listener) {
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry must not be null");
        this.evaluatorRegistry =
                Objects.requireNonNull(evaluatorRegistry, "evaluatorRegistry must not be null");
        this.artifactResolver =
                Objects.requireNonNull(artifactResolver, "artifactResolver must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.artifactValidator =
                new ArtifactValidator(config.getMaxArtifactBytes(), config.getAcceptedMimeTypes());
        this.schedulingPolicy = config.getSchedulingPolicy();
        this.evaluatorPool = WorkerPools.newEvaluatorPool();
        // queued tasks still need the evaluator pool after shutdown()
        this.workerPool = WorkerPools.newWorkerPool(config.getWorkerPoolSize(), evaluatorPool::shutdown);
        this.taskContext =
                new TaskContext(evaluatorPool, config.getTaskTimeout(), classifier, listener);

        logger.info(
                "Evaluation dispatcher started with "
                        + config.getWorkerPoolSize()
                        + " workers, timeout "
                        + config.getTaskTimeout().toMillis()
                        + "ms, policy "
                        + schedulingPolicy);
    }

    /// Submits a request for evaluation.
    ///
    /// Returns once the request is validated and its tasks are queued; results
    /// arrive asynchronously on `sink`. Rejections are delivered to `sink`
    /// before this method returns.
    ///
    /// @param request the request, not null
    /// @param sink receiver of the session's events, not null
    /// @return the session handle, never null; terminal at once if rejected or empty
    public EvaluationSession submit(EvaluationRequest request, EvaluationEventSink sink) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        String sessionId = request.sessionId();

        if (workerPool.isShutdown()) {
            return reject(
                    sessionId, EvaluationEvent.GeneralError.of(sessionId, "Evaluation service is shutting down"), sink);
        }

        ResolvedArtifact artifact;
        try {
            artifact = artifactResolver.resolve(request.artifact());
        } catch (ArtifactUnavailableException e) {
            logger.warning("Artifact unavailable for session " + sessionId + ": " + e.getMessage());
            return reject(sessionId, EvaluationEvent.GeneralError.of(sessionId, e.getMessage()), sink);
        }

        List<String> metricIds = List.copyOf(new LinkedHashSet<>(request.metricIds()));
        List<String> problems = new ArrayList<>();
        for (String metricId : metricIds) {
            if (!metricRegistry.contains(metricId)) {
                problems.add("Unknown metric '" + metricId + "'");
            } else if (!evaluatorRegistry.hasEvaluator(metricId)) {
                problems.add("No evaluator available for metric '" + metricId + "'");
            }
        }
        problems.addAll(artifactValidator.validate(artifact));
        if (activeSessions.containsKey(sessionId)) {
            problems.add("Session '" + sessionId + "' is already active");
        }
        if (!problems.isEmpty()) {
            return reject(sessionId, EvaluationEvent.ValidationError.of(sessionId, problems), sink);
        }

        EvaluationSession session = new EvaluationSession(sessionId, metricIds, sink, new SessionHooks());
        if (activeSessions.putIfAbsent(sessionId, session) != null) {
            return reject(
                    sessionId,
                    EvaluationEvent.ValidationError.of(
                            sessionId, List.of("Session '" + sessionId + "' is already active")),
                    sink);
        }

        listener.onSessionStart(session);
        logger.fine("Session " + sessionId + " started with metrics " + metricIds);
        if (metricIds.isEmpty()) {
            session.start();
            return session;
        }

        schedule(session, metricIds, artifact);
        return session;
    }

    private void schedule(EvaluationSession session, List<String> metricIds, ResolvedArtifact artifact) {
        List<MetricDescriptor> metrics = new ArrayList<>();
        for (String metricId : metricIds) {
            metricRegistry.find(metricId).ifPresent(metrics::add);
        }
        metrics.sort(Comparator.comparingInt(m -> metricRegistry.registrationIndex(m.getId())));

        List<EvaluationTask> tasks = new ArrayList<>(metrics.size());
        for (MetricDescriptor metric : metrics) {
            tasks.add(
                    new EvaluationTask(
                            session,
                            metric,
                            evaluatorRegistry.getEvaluator(metric.getId()).orElseThrow(),
                            artifact,
                            sequence.getAndIncrement(),
                            schedulingPolicy,
                            taskContext));
        }
        sessionTasks.put(session.getId(), tasks);

        for (EvaluationTask task : tasks) {
            try {
                workerPool.execute(task);
            } catch (RejectedExecutionException e) {
                logger.warning("Worker pool rejected metric '" + task.getMetricId() + "'");
                task.drop();
                session.report(
                        new TaskOutcome.Failure(
                                task.getMetricId(),
                                EvaluationException.Kind.COMPUTATION_FAILURE,
                                "Evaluation service is shutting down"));
            }
        }
    }

    private EvaluationSession reject(String sessionId, EvaluationEvent rejection, EvaluationEventSink sink) {
        EvaluationSession session = EvaluationSession.rejected(sessionId, rejection, sink);
        listener.onSessionRejected(sessionId, rejection);
        return session;
    }

    /// Cancels an active session.
    ///
    /// Queued tasks are removed from the worker queue; running tasks finish
    /// or time out and their results are discarded.
    ///
    /// @param sessionId the session id, not null
    /// @return `true` if an active session was cancelled
    public boolean cancel(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        EvaluationSession session = activeSessions.get(sessionId);
        return session != null && session.cancel();
    }

    /// Returns an active session.
    ///
    /// @param sessionId the session id, not null
    /// @return the session, or empty if unknown or already finished
    public Optional<EvaluationSession> findSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    /// Returns the number of tasks waiting for a worker.
    ///
    /// @return queue length
    public int getQueuedTaskCount() {
        return workerPool.getQueue().size();
    }

    /// Stops accepting requests; already queued tasks still run.
    ///
    /// The evaluator pool is shut down once the worker pool has terminated.
    public void shutdown() {
        logger.info("Shutting down evaluation dispatcher with " + activeSessions.size() + " active sessions");
        workerPool.shutdown();
    }

    /// Cancels every active session and stops all pools at once.
    public void shutdownNow() {
        activeSessions.values().forEach(EvaluationSession::cancel);
        workerPool.shutdownNow();
        evaluatorPool.shutdownNow();
    }

    /// Waits for queued and running tasks to finish after {@link #shutdown()}.
    ///
    /// @param timeout longest time to wait, not null
    /// @return `true` if the worker pool terminated in time
    /// @throws InterruptedException if interrupted while waiting
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        shutdown();
    }

    private final class SessionHooks implements EvaluationSession.Hooks {

        @Override
        public void onComplete(EvaluationSession session) {
            release(session);
            listener.onSessionComplete(session);
        }

        @Override
        public void onCancel(EvaluationSession session) {
            List<EvaluationTask> tasks = sessionTasks.getOrDefault(session.getId(), List.of());
            int dropped = 0;
            for (EvaluationTask task : tasks) {
                if (workerPool.remove(task) && task.drop()) {
                    dropped++;
                }
            }
            release(session);
            logger.info("Session " + session.getId() + " cancelled, " + dropped + " queued tasks dropped");
            listener.onSessionCancelled(session);
        }

        private void release(EvaluationSession session) {
            activeSessions.remove(session.getId(), session);
            sessionTasks.remove(session.getId());
        }
    }
}

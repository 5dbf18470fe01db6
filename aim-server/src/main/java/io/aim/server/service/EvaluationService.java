package io.aim.server.service;

import io.aim.core.AimEnvironment;
import io.aim.core.artifact.Artifact;
import io.aim.core.execution.EvaluationDispatcher;
import io.aim.core.execution.EvaluationRequest;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.session.EvaluationEvent;
import io.aim.server.streaming.EvaluationEventBroadcaster;
import io.aim.server.validation.InputValidator;
import io.aim.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.jboss.logging.Logger;

/// Entry point for clients requesting evaluations.
///
/// Validates the raw {@link EvaluationCommand} at the boundary, submits it to
/// the {@link EvaluationDispatcher} and returns the session's event stream.
///
/// ### Boundary Checks
/// - the session id, when given, is a safe identifier
/// - exactly one of inline data and locator is present
/// - inline data fits the artifact size limit and is valid base64
/// - a locator is a `data:` URL unless an artifact root is configured
/// - metric ids and mime types carry no control characters
///
/// Requests failing these checks never reach the dispatcher: the returned
/// stream holds a single `ValidationError` listing every problem. Everything
/// else (unknown metrics, unsupported artifacts, duplicate sessions) is
/// checked by the dispatcher and reported on the stream the same way.
///
/// @see EvaluationEventBroadcaster
@ApplicationScoped
public class EvaluationService {

    private static final Logger LOG = Logger.getLogger(EvaluationService.class);
    private static final String DATA_URL_PREFIX = "data:";

    private final AimEnvironment environment;
    private final EvaluationEventBroadcaster broadcaster;

    @Inject
    public EvaluationService(AimEnvironment environment, EvaluationEventBroadcaster broadcaster) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster must not be null");
    }

    /// Starts an evaluation.
    ///
    /// ### Contracts
    /// - **Postcondition**: the stream ends after exactly one terminal event
    ///   (`SessionComplete`, `ValidationError` or `GeneralError`)
    /// - **Postcondition**: cancelling the subscription cancels the session
    ///
    /// @apiNote **Side effects**: queues the session's tasks on the worker pool
    /// before returning; events buffer until the stream is subscribed.
    ///
    /// @param command the raw request, not null
    /// @return the session's events, never null
    public Multi<EvaluationEvent> evaluate(EvaluationCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        String sessionId =
                command.sessionId() != null ? command.sessionId() : UUID.randomUUID().toString();

        List<String> problems = new ArrayList<>();
        Artifact artifact = toArtifact(command, problems);
        checkSessionId(command.sessionId(), problems);
        checkMetricIds(command.metricIds(), problems);
        if (!problems.isEmpty()) {
            return reject(sessionId, problems);
        }

        EvaluationDispatcher dispatcher = environment.getDispatcher();
        Multi<EvaluationEvent> events;
        try {
            events = broadcaster.open(sessionId, () -> dispatcher.cancel(sessionId));
        } catch (IllegalStateException e) {
            return reject(sessionId, List.of("Session '" + sessionId + "' is already active"));
        }

        LOG.infov(
                "Evaluating session {0} with metrics {1}",
                LogSanitizer.sanitize(sessionId),
                LogSanitizer.sanitize(String.valueOf(command.metricIds())));
        dispatcher.submit(
                new EvaluationRequest(sessionId, artifact, command.metricIds()),
                broadcaster::publish);
        return events;
    }

    /// Cancels a running session.
    ///
    /// @param sessionId the session, not null
    /// @return `true` if an active session was cancelled
    public boolean cancel(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        boolean cancelled = environment.getDispatcher().cancel(sessionId);
        if (cancelled) {
            broadcaster.close(sessionId);
            LOG.infov("Cancelled session {0}", LogSanitizer.sanitize(sessionId));
        }
        return cancelled;
    }

    /// Returns the metrics clients may request, in registration order.
    ///
    /// @return unmodifiable list, never null
    public List<MetricDescriptor> listMetrics() {
        return environment.getMetricRegistry().all();
    }

    private Artifact toArtifact(EvaluationCommand command, List<String> problems) {
        boolean inline = command.artifactBase64() != null;
        boolean located = command.artifactUri() != null;
        if (inline == located) {
            problems.add("Exactly one of artifact data and artifact URI must be given");
            return null;
        }

        if (located) {
            if (command.artifactUri().isBlank()
                    || InputValidator.containsDangerousChars(command.artifactUri())) {
                problems.add("Invalid artifact URI");
                return null;
            }
            if (!isDataUrl(command.artifactUri()) && environment.getConfig().getArtifactRoot() == null) {
                problems.add("Artifact URI must be a data: URL");
                return null;
            }
            return Artifact.locator(command.artifactUri());
        }

        String mimeType = command.mimeType();
        if (mimeType == null || mimeType.isBlank()) {
            problems.add("Missing artifact mime type");
        } else if (InputValidator.containsDangerousChars(mimeType)) {
            problems.add("Invalid artifact mime type");
        }
        long limit = environment.getConfig().getMaxArtifactBytes();
        if (InputValidator.exceedsDecodedLimit(command.artifactBase64(), limit)) {
            problems.add("Artifact exceeds the limit of " + limit + " bytes");
            return null;
        }
        byte[] bytes = InputValidator.decodeBase64(command.artifactBase64()).orElse(null);
        if (bytes == null) {
            problems.add("Artifact data is not valid base64");
            return null;
        }
        return problems.isEmpty() ? Artifact.inline(bytes, mimeType) : null;
    }

    private static boolean isDataUrl(String uri) {
        return uri.regionMatches(true, 0, DATA_URL_PREFIX, 0, DATA_URL_PREFIX.length());
    }

    private static void checkSessionId(String sessionId, List<String> problems) {
        if (sessionId != null && !InputValidator.isSafeId(sessionId)) {
            problems.add("Invalid session id");
        }
    }

    private static void checkMetricIds(List<String> metricIds, List<String> problems) {
        if (metricIds == null) {
            return;
        }
        for (String metricId : metricIds) {
            if (metricId == null || metricId.isBlank() || InputValidator.containsDangerousChars(metricId)) {
                problems.add("Invalid metric id");
                return;
            }
        }
    }

    private static Multi<EvaluationEvent> reject(String sessionId, List<String> problems) {
        LOG.warnv(
                "Rejected session {0}: {1}",
                LogSanitizer.sanitize(sessionId),
                LogSanitizer.sanitize(String.join("; ", problems)));
        return Multi.createFrom().item(EvaluationEvent.ValidationError.of(sessionId, problems));
    }
}

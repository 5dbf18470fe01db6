package io.aim.core.execution;

import io.aim.core.artifact.Artifact;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/// A client's request to evaluate one artifact with a set of metrics.
///
/// @param sessionId correlation id echoed in every event; generated when null
/// @param artifact the artifact to evaluate, not null
/// @param metricIds requested metric ids, may contain repeats, may be empty
public record EvaluationRequest(String sessionId, Artifact artifact, List<String> metricIds) {

    public EvaluationRequest {
        Objects.requireNonNull(artifact, "artifact must not be null");
        sessionId = sessionId != null ? sessionId : UUID.randomUUID().toString();
        metricIds = metricIds != null ? List.copyOf(metricIds) : List.of();
    }

    /// Creates a request with a generated session id.
    ///
    /// @param artifact the artifact, not null
    /// @param metricIds requested metric ids, not null
    /// @return the request, never null
    public static EvaluationRequest of(Artifact artifact, List<String> metricIds) {
        return new EvaluationRequest(null, artifact, metricIds);
    }
}

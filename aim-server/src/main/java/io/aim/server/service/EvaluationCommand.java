package io.aim.server.service;

import java.util.List;

/// A client's evaluation request as received, before boundary validation.
///
/// Exactly one of `artifactBase64` and `artifactUri` is expected.
///
/// @param sessionId requested session id, or null to generate one
/// @param artifactBase64 inline artifact bytes in base64, may be null
/// @param mimeType declared mime type of the inline artifact, may be null
/// @param artifactUri artifact locator (path, `file:` URI or `data:` URL), may be null
/// @param metricIds requested metric ids, may be null
public record EvaluationCommand(
        String sessionId,
        String artifactBase64,
        String mimeType,
        String artifactUri,
        List<String> metricIds) {

    /// Creates a command carrying the artifact inline.
    public static EvaluationCommand inline(
            String sessionId, String artifactBase64, String mimeType, List<String> metricIds) {
        return new EvaluationCommand(sessionId, artifactBase64, mimeType, null, metricIds);
    }

    /// Creates a command referencing the artifact by locator.
    public static EvaluationCommand located(
            String sessionId, String artifactUri, List<String> metricIds) {
        return new EvaluationCommand(sessionId, null, null, artifactUri, metricIds);
    }
}

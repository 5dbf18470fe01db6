package io.aim.core.artifact;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Checks that a resolved artifact is something the evaluators can decode.
///
/// The checks are cheap: emptiness, size, declared mime type and the file
/// signature (leading magic bytes) for that mime type. Full decoding is left
/// to the evaluators, which report undecodable input as
/// {@link io.aim.core.evaluator.EvaluationException.Kind#INVALID_INPUT}.
public class ArtifactValidator {

    private static final Map<String, byte[]> SIGNATURES =
            Map.of(
                    "image/png",
                    new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'},
                    "image/jpeg",
                    new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF});

    private final long maxBytes;
    private final Set<String> acceptedMimeTypes;

    /// @param maxBytes largest accepted artifact, in bytes
    /// @param acceptedMimeTypes mime types evaluators can decode, not null
    public ArtifactValidator(long maxBytes, Set<String> acceptedMimeTypes) {
        this.maxBytes = maxBytes;
        this.acceptedMimeTypes = Set.copyOf(Objects.requireNonNull(acceptedMimeTypes));
    }

    /// Validates the artifact.
    ///
    /// @param artifact the resolved artifact, not null
    /// @return problems found, empty if the artifact is acceptable
    public List<String> validate(ResolvedArtifact artifact) {
        List<String> problems = new ArrayList<>();
        if (artifact.isEmpty()) {
            problems.add("Artifact is empty");
            return problems;
        }
        if (artifact.size() > maxBytes) {
            problems.add(
                    "Artifact is "
                            + artifact.size()
                            + " bytes, exceeding the limit of "
                            + maxBytes
                            + " bytes");
        }
        String mimeType = artifact.mimeType().toLowerCase(Locale.ROOT);
        if (!acceptedMimeTypes.contains(mimeType)) {
            problems.add(
                    "Unsupported artifact type '"
                            + artifact.mimeType()
                            + "', expected one of "
                            + acceptedMimeTypes.stream().sorted().toList());
            return problems;
        }
        byte[] signature = SIGNATURES.get(mimeType);
        if (signature != null && !artifact.startsWith(signature)) {
            problems.add("Artifact content does not match its declared type " + mimeType);
        }
        return problems;
    }
}

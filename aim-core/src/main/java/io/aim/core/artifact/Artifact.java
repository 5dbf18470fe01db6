package io.aim.core.artifact;

import java.util.Arrays;
import java.util.Objects;

/// The design artifact submitted for evaluation.
///
/// Either carried inline as bytes with a declared mime type, or referenced
/// through an opaque locator that an {@link ArtifactResolver} turns into
/// bytes before any metric runs.
///
/// @see ResolvedArtifact
public sealed interface Artifact permits Artifact.Inline, Artifact.Locator {

    /// Creates an inline artifact.
    ///
    /// @param bytes encoded image bytes, not null (copied)
    /// @param mimeType declared mime type, not null
    /// @return the artifact, never null
    static Artifact inline(byte[] bytes, String mimeType) {
        return new Inline(bytes, mimeType);
    }

    /// Creates an artifact reference.
    ///
    /// @param uri locator understood by the configured resolver, not null
    /// @return the artifact, never null
    static Artifact locator(String uri) {
        return new Locator(uri);
    }

    /// Artifact bytes carried with the request.
    ///
    /// @param bytes encoded image bytes
    /// @param mimeType declared mime type
    record Inline(byte[] bytes, String mimeType) implements Artifact {
        public Inline {
            Objects.requireNonNull(bytes, "bytes must not be null");
            Objects.requireNonNull(mimeType, "mimeType must not be null");
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Inline other
                    && mimeType.equals(other.mimeType)
                    && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * mimeType.hashCode() + Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Inline[" + mimeType + ", " + bytes.length + " bytes]";
        }
    }

    /// Artifact referenced by location.
    ///
    /// @param uri file path, `file:` URI or `data:` URL
    record Locator(String uri) implements Artifact {
        public Locator {
            Objects.requireNonNull(uri, "uri must not be null");
        }
    }
}

package io.aim.core.artifact;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/// Artifact bytes ready for evaluation.
///
/// Shared read-only by every evaluator of a session. The backing array is
/// never exposed: {@link #bytes()} returns a copy and {@link #openStream()}
/// reads without copying.
public final class ResolvedArtifact {

    private final byte[] data;
    private final String mimeType;

    public ResolvedArtifact(byte[] data, String mimeType) {
        this.data = Objects.requireNonNull(data, "data must not be null").clone();
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType must not be null");
    }

    /// Returns a copy of the artifact bytes.
    ///
    /// @return new array, never null
    public byte[] bytes() {
        return data.clone();
    }

    /// Opens a stream over the artifact bytes.
    ///
    /// @return a fresh stream positioned at the first byte, never null
    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }

    /// Tests whether the artifact begins with the given bytes.
    ///
    /// @param prefix expected leading bytes, not null
    /// @return `true` if every prefix byte matches
    public boolean startsWith(byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public String mimeType() {
        return mimeType;
    }

    @Override
    public String toString() {
        return "ResolvedArtifact[" + mimeType + ", " + data.length + " bytes]";
    }
}

package io.aim.core.exception;

import java.io.Serial;

/// Thrown when an artifact locator cannot be turned into artifact bytes.
public class ArtifactUnavailableException extends Exception {
    @Serial private static final long serialVersionUID = -8214409127358176624L;

    public ArtifactUnavailableException(String message) {
        super(message);
    }

    public ArtifactUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

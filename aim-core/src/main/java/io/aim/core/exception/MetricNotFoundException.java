package io.aim.core.exception;

import java.io.Serial;

public class MetricNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 3127750981266450203L;

    public MetricNotFoundException(String message) {
        super(message);
    }
}

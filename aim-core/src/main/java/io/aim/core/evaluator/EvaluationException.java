package io.aim.core.evaluator;

import java.io.Serial;
import java.util.Objects;

/// Thrown when a metric cannot produce its values.
///
/// The failure stays isolated to the one metric: the dispatcher converts it
/// into a failed {@link io.aim.core.execution.TaskOutcome} and the rest of the
/// session continues.
public class EvaluationException extends Exception {
    @Serial private static final long serialVersionUID = -2967101722004419342L;

    /// Failure category reported to the client.
    public enum Kind {
        /// The artifact could not be decoded or is unsuitable for the metric.
        INVALID_INPUT,

        /// The computation failed or produced values of the wrong shape.
        COMPUTATION_FAILURE,

        /// The computation did not finish within the task timeout.
        TIMEOUT
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public EvaluationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static EvaluationException invalidInput(String message, Throwable cause) {
        return new EvaluationException(Kind.INVALID_INPUT, message, cause);
    }

    public static EvaluationException computationFailure(String message) {
        return new EvaluationException(Kind.COMPUTATION_FAILURE, message);
    }

    public Kind getKind() {
        return kind;
    }
}

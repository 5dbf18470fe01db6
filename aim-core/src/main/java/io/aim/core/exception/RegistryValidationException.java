package io.aim.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a metric registry document is structurally invalid.
///
/// Carries every problem found, not just the first, so that a broken
/// configuration can be fixed in one pass.
public class RegistryValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 5519306233745123988L;

    private final List<String> problems;

    public RegistryValidationException(List<String> problems) {
        super(formatMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public RegistryValidationException(String problem, Throwable cause) {
        super(formatMessage(List.of(problem)), cause);
        this.problems = List.of(problem);
    }

    /// Returns the individual problems found.
    ///
    /// @return unmodifiable list of problem descriptions, never empty
    public List<String> getProblems() {
        return problems;
    }

    private static String formatMessage(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid metric registry: " + problems.get(0);
        }
        return "Invalid metric registry (" + problems.size() + " problems): "
                + String.join("; ", problems);
    }
}

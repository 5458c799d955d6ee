package com.configsentinel.core.model;

import java.util.Objects;

/**
 * A single diagnostic produced while validating a collection.
 *
 * @param message human-readable description of the problem, never blank
 * @param severity severity of the problem, defaults to {@link Severity#FATAL}
 */
public record ValidationError(
    String message,
    Severity severity
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("ValidationError message must not be null or blank");
        }
        if (severity == null) {
            severity = Severity.FATAL;
        }
    }

    /**
     * Creates a fatal error.
     *
     * @param message error message
     * @return fatal error
     */
    public static ValidationError fatal(String message) {
        return new ValidationError(message, Severity.FATAL);
    }

    /**
     * Creates a warning.
     *
     * @param message warning message
     * @return warning entry
     */
    public static ValidationError warning(String message) {
        return new ValidationError(message, Severity.WARNING);
    }

    /**
     * Creates an informational entry.
     *
     * @param message info message
     * @return info entry
     */
    public static ValidationError info(String message) {
        return new ValidationError(message, Severity.INFO);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + Objects.toString(message);
    }
}

package com.configsentinel.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one validation pass.
 *
 * <p>Each call to {@code Schema.validate} returns its own result, so results of
 * separate passes never mix.</p>
 *
 * @param errors every diagnostic raised during the pass, in the order raised
 */
public record ValidationResult(
    List<ValidationError> errors
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a result with no diagnostics.
     *
     * @return empty result
     */
    public static ValidationResult empty() {
        return new ValidationResult(List.of());
    }

    /**
     * Returns true if no fatal error was raised.
     *
     * @return true if the collection may be used
     */
    public boolean isValid() {
        return !anyFatal(errors);
    }

    /**
     * Returns true if any diagnostic, of any severity, was raised.
     *
     * @return true if the error list is non-empty
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ValidationError> fatalErrors() {
        return ofSeverity(Severity.FATAL);
    }

    public List<ValidationError> warnings() {
        return ofSeverity(Severity.WARNING);
    }

    /**
     * Returns the diagnostics of one severity.
     *
     * @param severity severity to filter on
     * @return matching diagnostics
     */
    public List<ValidationError> ofSeverity(Severity severity) {
        return errors.stream()
            .filter(error -> error.severity() == severity)
            .toList();
    }

    /**
     * Appends the diagnostics of another result to this one.
     *
     * @param other result to append
     * @return new combined result
     */
    public ValidationResult merge(ValidationResult other) {
        List<ValidationError> combined = new ArrayList<>(errors);
        combined.addAll(other.errors());
        return new ValidationResult(combined);
    }

    /**
     * Checks a list of diagnostics for a fatal entry.
     *
     * @param errors diagnostics to check
     * @return true if at least one entry is fatal
     */
    public static boolean anyFatal(List<ValidationError> errors) {
        for (ValidationError error : errors) {
            if (error.isFatal()) {
                return true;
            }
        }
        return false;
    }
}

package com.configsentinel.core.constraint;

import com.configsentinel.core.conversion.Conversions;
import com.configsentinel.core.model.ValidationError;

import java.util.List;
import java.util.Objects;

/**
 * A named, stateless rule applied to a field value.
 *
 * <p>Constraints hold no mutable state, so one instance can be attached to many fields and
 * evaluated concurrently. Most constraints come from the factories in {@link Constraints};
 * custom ones are built with {@link #of(String, ConstraintFunction)}:
 *
 * <pre>{@code
 * Constraint<Integer> even = Constraint.of("Even", (value, field) ->
 *     value % 2 == 0 ? List.of() : List.of(ValidationError.fatal(field + " must be even")));
 * }</pre>
 *
 * @param <T> type of value the constraint checks
 */
public final class Constraint<T> {

    private final String name;
    private final ConstraintType type;
    private final ConstraintFunction<T> function;
    private final ConstraintFunction<String> formatFunction;

    private Constraint(String name, ConstraintType type, ConstraintFunction<T> function,
                       ConstraintFunction<String> formatFunction) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Constraint name must not be null or blank");
        }
        this.name = name;
        this.type = type;
        this.function = function;
        this.formatFunction = formatFunction;
    }

    /**
     * Creates a constraint applied to the cast value.
     *
     * @param name constraint name
     * @param function check to run
     * @param <T> checked type
     * @return standard constraint
     */
    public static <T> Constraint<T> of(String name, ConstraintFunction<T> function) {
        return new Constraint<>(name, ConstraintType.STANDARD,
            Objects.requireNonNull(function, "function must not be null"), null);
    }

    /**
     * Creates a constraint applied to the raw text of the value.
     *
     * @param name constraint name
     * @param formatFunction check to run on the raw text
     * @param <T> type of the field this constraint may be attached to
     * @return format constraint
     */
    public static <T> Constraint<T> format(String name, ConstraintFunction<String> formatFunction) {
        return new Constraint<>(name, ConstraintType.FORMAT, null,
            Objects.requireNonNull(formatFunction, "formatFunction must not be null"));
    }

    public String getName() {
        return name;
    }

    public ConstraintType getType() {
        return type;
    }

    /**
     * Evaluates the constraint against a cast value. Format constraints check the value's
     * string rendering.
     *
     * @param value value to check
     * @param fieldName name of the field holding the value
     * @return diagnostics, empty if the value passes
     */
    public List<ValidationError> evaluate(T value, String fieldName) {
        if (type == ConstraintType.FORMAT) {
            return evaluateFormat(Conversions.stringify(value), fieldName);
        }
        return orEmpty(function.apply(value, fieldName));
    }

    /**
     * Evaluates a format constraint against raw text.
     *
     * @param rawText raw text of the value
     * @param fieldName name of the field holding the value
     * @return diagnostics, empty if the text passes
     * @throws IllegalStateException if this is not a format constraint
     */
    public List<ValidationError> evaluateFormat(String rawText, String fieldName) {
        if (type != ConstraintType.FORMAT) {
            throw new IllegalStateException("Constraint " + name + " is not a format constraint");
        }
        return orEmpty(formatFunction.apply(rawText, fieldName));
    }

    private static List<ValidationError> orEmpty(List<ValidationError> errors) {
        return errors == null ? List.of() : errors;
    }

    @Override
    public String toString() {
        return name;
    }
}

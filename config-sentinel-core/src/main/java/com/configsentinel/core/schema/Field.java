package com.configsentinel.core.schema;

import com.configsentinel.core.constraint.Constraint;
import com.configsentinel.core.constraint.ConstraintType;
import com.configsentinel.core.conversion.ValueType;
import com.configsentinel.core.model.ValidationError;
import com.configsentinel.core.model.ValidationResult;
import com.configsentinel.core.translator.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, typed slot in a {@link Schema}.
 *
 * <p>Fields are immutable once built and can be shared by any number of schemas and
 * concurrent validations. Equality is by name, since a schema holds at most one field per name.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Field<Integer> port = Field.builder("port", "TCP port to listen on", Integer.class)
 *     .optional()
 *     .defaultValue(8080)
 *     .constraint(Constraints.constrainValue(1, 65535))
 *     .build();
 * }</pre>
 *
 * @param <T> type the raw value is cast to before constraints run
 * @since 1.0.0
 */
public final class Field<T> {

    private static final Logger log = LoggerFactory.getLogger(Field.class);

    private final String name;
    private final String helpText;
    private final ValueType<T> valueType;
    private final boolean required;
    private final T defaultValue;
    private final boolean allowEmpty;
    private final List<Constraint<? super T>> constraints;

    private Field(Builder<T> builder) {
        this.name = builder.name;
        this.helpText = builder.helpText;
        this.valueType = builder.valueType;
        this.required = builder.required;
        this.defaultValue = builder.defaultValue;
        this.allowEmpty = builder.allowEmpty;
        this.constraints = List.copyOf(builder.constraints);
    }

    /**
     * Starts a field definition.
     *
     * @param name unique field name
     * @param helpText description shown to operators in diagnostics
     * @param valueType type the raw value is cast to
     * @param <T> value type
     * @return builder, required by default
     * @throws IllegalArgumentException if name or help text is null or blank
     */
    public static <T> Builder<T> builder(String name, String helpText, ValueType<T> valueType) {
        return new Builder<>(name, helpText, valueType);
    }

    public static <T> Builder<T> builder(String name, String helpText, Class<T> valueType) {
        return new Builder<>(name, helpText, ValueType.of(Objects.requireNonNull(valueType, "valueType must not be null")));
    }

    public String getName() {
        return name;
    }

    public String getHelpText() {
        return helpText;
    }

    public ValueType<T> getValueType() {
        return valueType;
    }

    public boolean isRequired() {
        return required;
    }

    public Optional<T> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public boolean isAllowEmpty() {
        return allowEmpty;
    }

    public List<Constraint<? super T>> getConstraints() {
        return constraints;
    }

    /**
     * Validates this field's value in a collection.
     *
     * <p>Steps, in order: presence (with default insertion for optional fields), null/empty check,
     * cast, then every constraint in declaration order. Constraints never short-circuit each other.
     *
     * @param collection collection holding the value; receives the default if one is inserted
     * @param translator translator for the collection
     * @param contextName name of the collection used in messages, null if anonymous
     * @param <C> collection type
     * @return diagnostics for this field, empty if the value is valid
     */
    public <C> List<ValidationError> validate(C collection, Translator<? super C> translator, String contextName) {
        Objects.requireNonNull(translator, "translator must not be null");
        List<ValidationError> errors = new ArrayList<>();

        if (!translator.collectionContains(collection, name)) {
            if (required) {
                errors.add(ValidationError.fatal("Input " + (contextName == null ? "collection" : contextName)
                    + " is missing required field " + name + ": " + helpText));
                return errors;
            }
            if (defaultValue == null) {
                return errors;
            }
            log.debug("Inserting default value for field '{}': {}", name, defaultValue);
            try {
                translator.insertFieldValue(collection, name, defaultValue);
            } catch (UnsupportedOperationException | IllegalArgumentException e) {
                errors.add(ValidationError.fatal("Default value for field " + name
                    + " could not be inserted: " + e.getMessage()));
                return errors;
            }
        }

        if (translator.fieldValueIsNullOrEmpty(collection, name)) {
            if (required) {
                String message = "Value of field " + name + " is null or empty.";
                errors.add(allowEmpty ? ValidationError.warning(message) : ValidationError.fatal(message));
            }
            return errors;
        }

        Optional<T> cast = translator.tryCastValue(collection, name, valueType);
        if (cast.isEmpty()) {
            errors.add(ValidationError.fatal("Field " + name + " with value "
                + translator.collectionValueToString(collection, name) + " is an incorrect type. Expected: "
                + translator.getEquivalentType(valueType.simpleName())));
            errors.add(helpTextInfo());
            return errors;
        }

        T value = cast.get();
        for (Constraint<? super T> constraint : constraints) {
            errors.addAll(evaluate(constraint, value, collection, translator));
        }
        if (ValidationResult.anyFatal(errors)) {
            errors.add(helpTextInfo());
        }
        return errors;
    }

    private <C> List<ValidationError> evaluate(Constraint<? super T> constraint, T value, C collection,
                                               Translator<? super C> translator) {
        try {
            if (constraint.getType() == ConstraintType.FORMAT) {
                return constraint.evaluateFormat(translator.collectionValueToString(collection, name), name);
            }
            return constraint.evaluate(value, name);
        } catch (RuntimeException e) {
            log.warn("Constraint {} failed on field '{}': {}", constraint.getName(), name, e.getMessage());
            return List.of(ValidationError.fatal("Constraint " + constraint.getName() + " could not be evaluated for field "
                + name + ": " + e.getMessage()));
        }
    }

    private ValidationError helpTextInfo() {
        return ValidationError.info(name + ": " + helpText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Field<?> other)) {
            return false;
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + valueType + (required ? ", required" : ", optional") + ")";
    }

    /**
     * Builder for {@link Field}.
     *
     * @param <T> value type
     */
    public static final class Builder<T> {
        private final String name;
        private final String helpText;
        private final ValueType<T> valueType;
        private boolean required = true;
        private T defaultValue;
        private boolean allowEmpty;
        private final List<Constraint<? super T>> constraints = new ArrayList<>();

        private Builder(String name, String helpText, ValueType<T> valueType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be null or blank");
            }
            if (helpText == null || helpText.isBlank()) {
                throw new IllegalArgumentException("Help text for field " + name + " must not be null or blank");
            }
            this.name = name;
            this.helpText = helpText;
            this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
        }

        public Builder<T> optional() {
            this.required = false;
            return this;
        }

        public Builder<T> required(boolean required) {
            this.required = required;
            return this;
        }

        /**
         * Sets the value inserted when the field is absent. Only used for optional fields.
         */
        public Builder<T> defaultValue(T defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /**
         * Reports a null or empty value of a required field as a warning instead of a fatal error.
         */
        public Builder<T> allowEmpty() {
            this.allowEmpty = true;
            return this;
        }

        public Builder<T> constraint(Constraint<? super T> constraint) {
            constraints.add(Objects.requireNonNull(constraint, "constraint must not be null"));
            return this;
        }

        @SafeVarargs
        public final Builder<T> constraints(Constraint<? super T>... constraints) {
            for (Constraint<? super T> constraint : constraints) {
                constraint(constraint);
            }
            return this;
        }

        public Field<T> build() {
            return new Field<>(this);
        }
    }
}

package com.configsentinel.core.schema;

import com.configsentinel.core.model.ValidationError;
import com.configsentinel.core.model.ValidationResult;
import com.configsentinel.core.translator.Translator;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of uniquely named {@link Field}s and the orchestration that validates a collection
 * against them.
 *
 * <p>Validation never stops at the first problem: every field is processed and every
 * diagnostic is returned in a fresh {@link ValidationResult}. A schema keeps no per-call state,
 * so concurrent {@code validate} calls on one instance are safe as long as no field is added
 * or removed meanwhile.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Schema schema = new Schema(
 *     Field.builder("host", "Host name of the database", String.class).build(),
 *     Field.builder("port", "Port of the database", Integer.class)
 *         .optional()
 *         .defaultValue(5432)
 *         .build());
 *
 * ValidationResult result = schema.validate(configNode, new JsonNodeTranslator());
 * if (!result.isValid()) {
 *     result.fatalErrors().forEach(error -> log.error("{}", error));
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class Schema {

    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    private final Map<String, Field<?>> fields = new LinkedHashMap<>();

    public Schema() {
    }

    public Schema(Field<?>... fields) {
        addFields(Arrays.asList(fields));
    }

    public Schema(Collection<? extends Field<?>> fields) {
        addFields(fields);
    }

    // ==================== Field Management ====================

    /**
     * Adds a field.
     *
     * @param field field to add
     * @return this schema
     * @throws IllegalArgumentException if a field with the same name is already present
     */
    public Schema addField(Field<?> field) {
        Objects.requireNonNull(field, "field must not be null");
        if (fields.containsKey(field.getName())) {
            throw new IllegalArgumentException("Field names must be unique. Schema already contains a field named "
                + field.getName());
        }
        fields.put(field.getName(), field);
        return this;
    }

    /**
     * Adds several fields. Nothing is added if any name collides.
     *
     * @param newFields fields to add
     * @return this schema
     * @throws IllegalArgumentException if any name is already present or repeated
     */
    public Schema addFields(Collection<? extends Field<?>> newFields) {
        Objects.requireNonNull(newFields, "fields must not be null");
        List<String> names = new ArrayList<>();
        for (Field<?> field : newFields) {
            Objects.requireNonNull(field, "field must not be null");
            if (fields.containsKey(field.getName()) || names.contains(field.getName())) {
                throw new IllegalArgumentException("Field names must be unique. Duplicate field name: "
                    + field.getName());
            }
            names.add(field.getName());
        }
        newFields.forEach(this::addField);
        return this;
    }

    /**
     * Removes a field by name.
     *
     * @param name field name
     * @return this schema
     * @throws IllegalArgumentException if no field has that name
     */
    public Schema removeField(String name) {
        if (!fields.containsKey(name)) {
            throw new IllegalArgumentException("Schema does not contain a field named " + name);
        }
        fields.remove(name);
        return this;
    }

    /**
     * Removes several fields by name. Nothing is removed if any name is absent.
     *
     * @param names field names
     * @return this schema
     * @throws IllegalArgumentException if any name is absent
     */
    public Schema removeFields(String... names) {
        for (String name : names) {
            if (!fields.containsKey(name)) {
                throw new IllegalArgumentException("Schema does not contain a field named " + name);
            }
        }
        for (String name : names) {
            fields.remove(name);
        }
        return this;
    }

    public int fieldCount() {
        return fields.size();
    }

    public boolean containsField(String name) {
        return fields.containsKey(name);
    }

    public Optional<Field<?>> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public List<Field<?>> getFields() {
        return List.copyOf(fields.values());
    }

    /**
     * Returns a new schema holding the same fields. Fields are immutable and shared.
     */
    public Schema copy() {
        return new Schema(fields.values());
    }

    // ==================== Validation ====================

    /**
     * Validates an anonymous collection, rejecting unrecognized keys.
     *
     * @param collection collection to validate; defaults of optional fields are inserted into it
     * @param translator translator for the collection
     * @param <C> collection type
     * @return all diagnostics of this pass
     */
    public <C> ValidationResult validate(C collection, Translator<? super C> translator) {
        return validate(collection, translator, ValidationOptions.defaults());
    }

    /**
     * Validates a collection.
     *
     * <p>Every field runs through presence, null/empty, cast and constraint checks. Keys that no
     * field declares are then handled per {@link ValidationOptions#unrecognizedFields()}. For a
     * named input, any fatal error adds a closing {@code Validation for <name> failed.} entry.
     *
     * @param collection collection to validate; defaults of optional fields are inserted into it
     * @param translator translator for the collection
     * @param options name and unrecognized-key policy for this pass
     * @param <C> collection type
     * @return all diagnostics of this pass
     */
    public <C> ValidationResult validate(C collection, Translator<? super C> translator, ValidationOptions options) {
        Objects.requireNonNull(translator, "translator must not be null");
        Objects.requireNonNull(options, "options must not be null");
        log.debug("Validating {} against {} fields", options.displayName(), fields.size());

        List<ValidationError> errors = new ArrayList<>();
        for (Field<?> field : fields.values()) {
            errors.addAll(field.validate(collection, translator, options.name()));
        }
        errors.addAll(checkUnrecognized(collection, translator, options));

        if (options.isNamed() && ValidationResult.anyFatal(errors)) {
            errors.add(ValidationError.info("Validation for " + options.name() + " failed."));
        }

        ValidationResult result = new ValidationResult(errors);
        log.debug("Validation of {} finished: {} diagnostics, valid={}",
            options.displayName(), errors.size(), result.isValid());
        return result;
    }

    private <C> List<ValidationError> checkUnrecognized(C collection, Translator<? super C> translator,
                                                        ValidationOptions options) {
        if (options.unrecognizedFields() == UnrecognizedFieldPolicy.IGNORE) {
            return List.of();
        }
        List<String> keys;
        try {
            keys = translator.getCollectionKeys(collection);
        } catch (UnsupportedOperationException e) {
            return List.of(ValidationError.fatal("Input " + options.displayName()
                + " is not a collection of named values: " + e.getMessage()));
        }

        List<ValidationError> errors = new ArrayList<>();
        for (String key : keys) {
            if (fields.containsKey(key)) {
                continue;
            }
            String message = "Input " + options.displayName() + " contains unrecognized field: " + key;
            errors.add(options.unrecognizedFields() == UnrecognizedFieldPolicy.REJECT
                ? ValidationError.fatal(message)
                : ValidationError.info(message));
        }
        return errors;
    }

    // ==================== Template ====================

    /**
     * Builds an example configuration: one property per field holding its help text, prefixed
     * with {@code Optional - } for optional fields.
     *
     * @return template object
     */
    public ObjectNode generateTemplate() {
        ObjectNode template = JsonNodeFactory.instance.objectNode();
        for (Field<?> field : fields.values()) {
            template.put(field.getName(), field.isRequired() ? field.getHelpText() : "Optional - " + field.getHelpText());
        }
        return template;
    }

    @Override
    public String toString() {
        return "Schema" + fields.keySet();
    }
}

package com.configsentinel.core.schema;

import java.util.Objects;

/**
 * Options for a single {@link Schema#validate} pass.
 *
 * @param name name of the validated input used in messages; null for an anonymous input
 * @param unrecognizedFields treatment of keys no field claims
 */
public record ValidationOptions(
    String name,
    UnrecognizedFieldPolicy unrecognizedFields
) {
    public ValidationOptions {
        Objects.requireNonNull(unrecognizedFields, "unrecognizedFields must not be null");
        if (name != null && name.isBlank()) {
            name = null;
        }
    }

    /**
     * Anonymous input, unrecognized keys rejected.
     */
    public static ValidationOptions defaults() {
        return new ValidationOptions(null, UnrecognizedFieldPolicy.REJECT);
    }

    public static ValidationOptions named(String name) {
        return defaults().withName(name);
    }

    public ValidationOptions withName(String newName) {
        return new ValidationOptions(newName, unrecognizedFields);
    }

    public ValidationOptions withUnrecognizedFields(UnrecognizedFieldPolicy policy) {
        return new ValidationOptions(name, policy);
    }

    /**
     * Returns the input's name, or {@code "collection"} for an anonymous input.
     */
    public String displayName() {
        return name == null ? "collection" : name;
    }

    public boolean isNamed() {
        return name != null;
    }
}

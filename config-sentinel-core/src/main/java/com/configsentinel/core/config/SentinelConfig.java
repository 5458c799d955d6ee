package com.configsentinel.core.config;

import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.schema.UnrecognizedFieldPolicy;
import com.configsentinel.core.schema.ValidationOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Library-level settings.
 *
 * <p>Loaded from {@code config-sentinel.yaml} by {@link ConfigLoader}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * dateTimeFormats:
 *   - "dd/MM/yyyy"
 *   - "yyyy-MM-dd HH:mm"
 *
 * validation:
 *   unrecognizedFields: REPORT
 * }</pre>
 *
 * @param dateTimeFormats extra date/time patterns, tried after the built-in ISO patterns
 * @param validation validation defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentinelConfig(
    @JsonProperty("dateTimeFormats") List<String> dateTimeFormats,
    @JsonProperty("validation") ValidationSettings validation
) {
    public SentinelConfig {
        dateTimeFormats = dateTimeFormats == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dateTimeFormats));
        validation = validation == null ? ValidationSettings.defaults() : validation;
    }

    /**
     * Creates a default configuration: ISO date/time patterns only, unrecognized keys rejected.
     *
     * @return default configuration
     */
    public static SentinelConfig defaults() {
        return new SentinelConfig(List.of(), ValidationSettings.defaults());
    }

    /**
     * Builds a date/time registry with the ISO patterns followed by the configured ones.
     *
     * @return new registry
     * @throws IllegalArgumentException if a configured pattern is invalid; {@link ConfigLoader}
     *         drops such patterns while loading
     */
    public DateTimeFormats toDateTimeFormats() {
        DateTimeFormats formats = DateTimeFormats.withDefaults();
        dateTimeFormats.forEach(formats::register);
        return formats;
    }

    /**
     * Returns a copy with other date/time patterns.
     *
     * @param patterns replacement patterns
     * @return new configuration with the same validation settings
     */
    public SentinelConfig withDateTimeFormats(List<String> patterns) {
        return new SentinelConfig(patterns, validation);
    }

    public ValidationOptions toValidationOptions() {
        return ValidationOptions.defaults().withUnrecognizedFields(validation.unrecognizedFields());
    }

    /**
     * Validation defaults.
     *
     * @param unrecognizedFields treatment of undeclared keys (null = REJECT)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("unrecognizedFields") UnrecognizedFieldPolicy unrecognizedFields
    ) {
        public ValidationSettings {
            unrecognizedFields = unrecognizedFields == null ? UnrecognizedFieldPolicy.REJECT : unrecognizedFields;
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(UnrecognizedFieldPolicy.REJECT);
        }
    }
}

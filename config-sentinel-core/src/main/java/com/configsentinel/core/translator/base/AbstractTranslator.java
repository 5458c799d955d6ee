package com.configsentinel.core.translator.base;

import com.configsentinel.core.conversion.Conversions;
import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.conversion.ValueType;
import com.configsentinel.core.translator.Translator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for translators.
 *
 * <p>Subclasses supply key lookup, raw value access and insertion for their representation.
 * This class owns everything that must behave the same across representations:
 * <ul>
 *   <li>String rendering of raw values</li>
 *   <li>Null/empty detection</li>
 *   <li>The ordered cast rule chain used by {@link #tryCastValue}</li>
 *   <li>JSON type labels for diagnostics</li>
 * </ul>
 *
 * @param <C> backing collection type
 * @since 1.0.0
 */
public abstract class AbstractTranslator<C> implements Translator<C> {

    private static final Logger log = LoggerFactory.getLogger(AbstractTranslator.class);

    /**
     * Date/time patterns consulted when casting to a date/time type.
     */
    protected final DateTimeFormats dateTimeFormats;

    /**
     * Creates a translator with the ISO date/time patterns.
     */
    protected AbstractTranslator() {
        this(DateTimeFormats.withDefaults());
    }

    /**
     * Creates a translator with a caller-owned date/time registry.
     *
     * @param dateTimeFormats registry to consult for date/time casts
     */
    protected AbstractTranslator(DateTimeFormats dateTimeFormats) {
        this.dateTimeFormats = Objects.requireNonNull(dateTimeFormats, "dateTimeFormats must not be null");
    }

    /**
     * Reads the raw stored value under {@code key}. Called only for keys that exist.
     *
     * @param collection collection to read
     * @param key value name
     * @return raw value, possibly null
     */
    protected abstract Object rawValue(C collection, String key);

    public DateTimeFormats getDateTimeFormats() {
        return dateTimeFormats;
    }

    @Override
    public String collectionValueToString(C collection, String key) {
        return Conversions.stringify(rawValue(collection, key));
    }

    @Override
    public boolean fieldValueIsNullOrEmpty(C collection, String key) {
        return !collectionContains(collection, key) || Conversions.isNullOrEmpty(rawValue(collection, key));
    }

    @Override
    public <T> Optional<T> tryCastValue(C collection, String key, ValueType<T> type) {
        if (!collectionContains(collection, key)) {
            return Optional.empty();
        }
        return tryCast(rawValue(collection, key), key, type);
    }

    /**
     * Casts a detached value, such as a sequence element, with the same rule chain as
     * {@link #tryCastValue}.
     *
     * @param raw value to cast
     * @param name name used in debug logging
     * @param type target type
     * @param <T> target type
     * @return cast value, or empty if the value cannot be represented as {@code type}
     */
    public <T> Optional<T> tryCast(Object raw, String name, ValueType<T> type) {
        try {
            return castValue(raw, type);
        } catch (RuntimeException e) {
            log.debug("Cast of '{}' to {} failed: {}", name, type, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getEquivalentType(String nativeTypeName) {
        return Conversions.equivalentJsonType(nativeTypeName);
    }

    // ==================== Cast Rule Chain ====================

    /**
     * Casts a raw value to {@code type}. Conversion failures may surface as runtime exceptions,
     * which {@link #tryCastValue} turns into an empty result.
     *
     * @param raw raw stored value
     * @param type target type
     * @param <T> target type
     * @return cast value, or empty if no rule applies
     */
    protected <T> Optional<T> castValue(Object raw, ValueType<T> type) {
        Class<T> target = type.rawType();
        if (raw == null) {
            return Optional.empty();
        }
        // 1. identity
        if (type.elementType() == null && target.isInstance(raw)) {
            return Optional.of(target.cast(raw));
        }
        Object value = raw instanceof JsonNode node && node.isValueNode() ? Conversions.unwrap(node) : raw;
        if (value == null) {
            return Optional.empty();
        }
        if (type.elementType() == null && target.isInstance(value)) {
            return Optional.of(target.cast(value));
        }
        // 2. string
        if (target == String.class) {
            return Optional.of(target.cast(Conversions.stringify(raw)));
        }
        // 3. date/time
        if (DateTimeFormats.isDateTimeType(target)) {
            return dateTimeFormats.parse(Conversions.stringify(raw), target);
        }
        // 4. structured
        if (type.isStructured()) {
            return castStructured(value, target);
        }
        // 5. sequence
        if (type.isSequence()) {
            return castSequence(value, type);
        }
        // 6. scalar fallback
        return Optional.of(Conversions.convertScalar(value, target));
    }

    private <T> Optional<T> castStructured(Object value, Class<T> target) {
        Optional<Map<String, Object>> members = Conversions.toMap(value);
        if (members.isEmpty()) {
            return Optional.empty();
        }
        if (target == ObjectNode.class) {
            return Optional.of(target.cast(Conversions.toNode(members.get())));
        }
        return Optional.of(target.cast(members.get()));
    }

    private <T> Optional<T> castSequence(Object value, ValueType<T> type) {
        Optional<List<Object>> elements = Conversions.elementsOf(value);
        if (elements.isEmpty()) {
            return Optional.empty();
        }
        List<Object> converted = new ArrayList<>();
        for (Object element : elements.get()) {
            if (type.elementType() == null) {
                converted.add(element);
                continue;
            }
            Optional<?> cast = castValue(element, type.elementType());
            if (cast.isEmpty()) {
                return Optional.empty();
            }
            converted.add(cast.get());
        }
        Class<T> target = type.rawType();
        if (target == ArrayNode.class) {
            return Optional.of(target.cast(Conversions.toNode(converted)));
        }
        Collection<Object> result = Set.class.isAssignableFrom(target) ? new LinkedHashSet<>(converted) : converted;
        return Optional.of(target.cast(result));
    }
}

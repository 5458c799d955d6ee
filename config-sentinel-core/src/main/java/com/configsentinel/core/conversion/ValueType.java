package com.configsentinel.core.conversion;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes the type a field value is cast to.
 *
 * <p>Java erases generic arguments at runtime, so a list target carries its element type
 * explicitly. Casting walks this description recursively.
 *
 * <p><b>Examples:</b>
 * <pre>{@code
 * ValueType<Integer> port = ValueType.of(Integer.class);
 * ValueType<List<String>> hosts = ValueType.listOf(String.class);
 * ValueType<Map<String, Object>> nested = ValueType.map();
 * }</pre>
 *
 * @param <T> Java type of the cast value
 */
public final class ValueType<T> {

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
        int.class, Integer.class,
        long.class, Long.class,
        short.class, Short.class,
        byte.class, Byte.class,
        double.class, Double.class,
        float.class, Float.class,
        boolean.class, Boolean.class,
        char.class, Character.class
    );

    private final Class<T> rawType;
    private final ValueType<?> elementType;

    private ValueType(Class<T> rawType, ValueType<?> elementType) {
        this.rawType = Objects.requireNonNull(rawType, "rawType must not be null");
        this.elementType = elementType;
    }

    /**
     * Creates a value type for a plain class. Primitive classes are boxed.
     *
     * @param type target class
     * @param <T> target type
     * @return value type
     */
    @SuppressWarnings("unchecked")
    public static <T> ValueType<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return new ValueType<>((Class<T>) PRIMITIVE_WRAPPERS.getOrDefault(type, type), null);
    }

    /**
     * Creates a list value type whose elements are cast to {@code elementType}.
     *
     * @param elementType element class
     * @param <E> element type
     * @return list value type
     */
    public static <E> ValueType<List<E>> listOf(Class<E> elementType) {
        return listOf(of(elementType));
    }

    /**
     * Creates a list value type whose elements are cast to {@code elementType}.
     *
     * @param elementType element value type, may itself be a list
     * @param <E> element type
     * @return list value type
     */
    @SuppressWarnings("unchecked")
    public static <E> ValueType<List<E>> listOf(ValueType<E> elementType) {
        Objects.requireNonNull(elementType, "elementType must not be null");
        return new ValueType<>((Class<List<E>>) (Class<?>) List.class, elementType);
    }

    /**
     * Creates a list value type that keeps elements as they are stored.
     *
     * @return untyped list value type
     */
    @SuppressWarnings("unchecked")
    public static ValueType<List<Object>> list() {
        return new ValueType<>((Class<List<Object>>) (Class<?>) List.class, null);
    }

    /**
     * Creates a structured value type; values are converted to string-keyed maps.
     *
     * @return map value type
     */
    @SuppressWarnings("unchecked")
    public static ValueType<Map<String, Object>> map() {
        return new ValueType<>((Class<Map<String, Object>>) (Class<?>) Map.class, null);
    }

    public Class<T> rawType() {
        return rawType;
    }

    /**
     * Returns the element type of a list target, or null if the target has none.
     *
     * @return element type or null
     */
    public ValueType<?> elementType() {
        return elementType;
    }

    /**
     * Returns true for targets filled by walking an object's members (maps and JSON objects).
     *
     * @return true for structured targets
     */
    public boolean isStructured() {
        return Map.class.isAssignableFrom(rawType) || rawType == ObjectNode.class;
    }

    /**
     * Returns true for ordered sequence targets (lists, collections and JSON arrays).
     *
     * @return true for sequence targets
     */
    public boolean isSequence() {
        return Collection.class.isAssignableFrom(rawType) || rawType == Iterable.class || rawType == ArrayNode.class;
    }

    /**
     * Short name used in diagnostics, e.g. {@code Integer} or {@code List}.
     *
     * @return simple type name
     */
    public String simpleName() {
        return rawType.getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueType<?> other)) {
            return false;
        }
        return rawType.equals(other.rawType) && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawType, elementType);
    }

    @Override
    public String toString() {
        return elementType == null ? simpleName() : simpleName() + "<" + elementType + ">";
    }
}

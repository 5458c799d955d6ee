package com.configsentinel.core.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.POJONode;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Value coercion helpers shared by every translator.
 *
 * <p>All translators route their string rendering, emptiness checks and scalar conversions
 * through this class, so a value stored in a JSON tree, a map or a record behaves the same.
 */
public final class Conversions {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final String JSON_NUMBER = "Json Number";
    private static final String JSON_STRING = "Json String";
    private static final String JSON_BOOLEAN = "Json Boolean";
    private static final String JSON_OBJECT = "Json Object";
    private static final String JSON_ARRAY = "Json Array";

    private static final Map<String, String> JSON_TYPE_LABELS = buildJsonTypeLabels();

    private Conversions() {
        // Utility class - prevent instantiation
    }

    // ==================== Rendering ====================

    /**
     * Renders a raw value as text.
     *
     * <p>JSON text nodes render without quotes; other JSON nodes render as JSON.
     *
     * @param value raw value
     * @return string rendering, {@code "null"} for null
     */
    public static String stringify(Object value) {
        if (value instanceof JsonNode node) {
            return node.isTextual() ? node.textValue() : node.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Maps a Java type name to the JSON type label shown in diagnostics.
     *
     * @param javaTypeName simple Java type name, e.g. {@code Integer}
     * @return label such as {@code Json Number}, or the name itself if unknown
     */
    public static String equivalentJsonType(String javaTypeName) {
        if (javaTypeName == null) {
            return "unknown";
        }
        if (javaTypeName.endsWith("[]")) {
            return JSON_ARRAY;
        }
        return JSON_TYPE_LABELS.getOrDefault(javaTypeName, javaTypeName);
    }

    // ==================== Emptiness ====================

    /**
     * Checks whether a value is null or empty.
     *
     * <p>Null, blank strings, empty arrays, empty collections and empty objects are empty.
     * An {@link Optional} or {@link Map.Entry} wrapper is looked through exactly once; a wrapper
     * inside a wrapper is judged by its string rendering.
     *
     * @param value value to check
     * @return true if the value is null or empty
     */
    public static boolean isNullOrEmpty(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.isEmpty() || isLeafNullOrEmpty(optional.get());
        }
        if (value instanceof Map.Entry<?, ?> entry) {
            return entry.getKey() == null
                || String.valueOf(entry.getKey()).isBlank()
                || isLeafNullOrEmpty(entry.getValue());
        }
        return isLeafNullOrEmpty(value);
    }

    private static boolean isLeafNullOrEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return true;
            }
            if (node.isTextual()) {
                return node.textValue().isBlank();
            }
            if (node.isContainerNode()) {
                return node.size() == 0;
            }
            return false;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return stringify(value).isBlank();
    }

    /**
     * Counts the elements or properties of an array-like or object-like value.
     *
     * @param value value to count
     * @return element/property count, or empty if the value is not countable
     */
    public static OptionalInt sizeOf(Object value) {
        if (value instanceof JsonNode node) {
            return node.isContainerNode() ? OptionalInt.of(node.size()) : OptionalInt.empty();
        }
        if (value instanceof Collection<?> collection) {
            return OptionalInt.of(collection.size());
        }
        if (value instanceof Map<?, ?> map) {
            return OptionalInt.of(map.size());
        }
        if (value instanceof Iterable<?> iterable) {
            int count = 0;
            for (Iterator<?> it = iterable.iterator(); it.hasNext(); it.next()) {
                count++;
            }
            return OptionalInt.of(count);
        }
        if (value != null && value.getClass().isArray()) {
            return OptionalInt.of(Array.getLength(value));
        }
        if (Members.isStructured(value)) {
            return OptionalInt.of(Members.names(value).size());
        }
        return OptionalInt.empty();
    }

    // ==================== Sequences and Structures ====================

    /**
     * Returns the elements of an ordered sequence value.
     *
     * @param value JSON array, Java collection/iterable or array
     * @return elements, or empty if the value is not a sequence
     */
    public static Optional<List<Object>> elementsOf(Object value) {
        List<Object> elements = new ArrayList<>();
        if (value instanceof JsonNode node) {
            if (!node.isArray()) {
                return Optional.empty();
            }
            node.forEach(elements::add);
        } else if (value instanceof Iterable<?> iterable && !(value instanceof Map<?, ?>)) {
            iterable.forEach(elements::add);
        } else if (value != null && value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                elements.add(Array.get(value, i));
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(elements);
    }

    /**
     * Converts an object-like value into a string-keyed map, recursing into nested objects.
     *
     * <p>Leaf members are copied as they are; JSON value nodes are unwrapped to Java values.
     *
     * @param value JSON object, map, record or plain object
     * @return map of the members, or empty if the value is not object-like
     */
    public static Optional<Map<String, Object>> toMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof JsonNode node) {
            if (!node.isObject()) {
                return Optional.empty();
            }
            node.fields().forEachRemaining(entry -> result.put(entry.getKey(), toPlain(entry.getValue())));
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, member) -> result.put(String.valueOf(key), toPlain(member)));
        } else if (Members.isStructured(value)) {
            for (String name : Members.names(value)) {
                result.put(name, toPlain(Members.get(value, name)));
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    private static Object toPlain(Object value) {
        if (value instanceof JsonNode node && node.isValueNode()) {
            return unwrap(node);
        }
        if (value instanceof JsonNode node && node.isArray()) {
            List<Object> elements = new ArrayList<>();
            node.forEach(element -> elements.add(toPlain(element)));
            return elements;
        }
        if (value instanceof JsonNode || value instanceof Map<?, ?> || Members.isStructured(value)) {
            return toMap(value).orElse(null);
        }
        if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
            return elementsOf(value).map(elements -> elements.stream().map(Conversions::toPlain).toList())
                .orElse(null);
        }
        return value;
    }

    /**
     * Converts a Java value into a JSON node.
     *
     * @param value value to convert
     * @return JSON node representation
     */
    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return NODES.textNode(value.toString());
        }
        if (value instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long number) {
            return NODES.numberNode(number);
        }
        if (value instanceof BigInteger number) {
            return NODES.numberNode(number);
        }
        if (value instanceof BigDecimal number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Float number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Double number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Map<?, ?> || Members.isStructured(value)) {
            ObjectNode object = NODES.objectNode();
            toMap(value).orElseGet(Map::of).forEach((key, member) -> object.set(key, toNode(member)));
            return object;
        }
        Optional<List<Object>> elements = elementsOf(value);
        if (elements.isPresent()) {
            ArrayNode array = NODES.arrayNode();
            elements.get().forEach(element -> array.add(toNode(element)));
            return array;
        }
        return NODES.textNode(stringify(value));
    }

    /**
     * Unwraps a JSON value node into the matching Java value.
     *
     * @param node JSON node
     * @return Java value for value nodes, the node itself for containers
     */
    public static Object unwrap(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node instanceof POJONode pojo) {
            return pojo.getPojo();
        }
        return node;
    }

    // ==================== Scalar Conversion ====================

    /**
     * Converts a scalar value to a numeric, boolean, character or enum target.
     *
     * <p>Numeric conversion never loses information: {@code "57"} becomes {@code 57},
     * {@code 3.0} becomes {@code 3}, but {@code 3.5} or an out-of-range value fails.
     *
     * @param value scalar value (already unwrapped from JSON)
     * @param target target type
     * @param <T> target type
     * @return converted value
     * @throws IllegalArgumentException if the value cannot be converted
     * @throws ArithmeticException if a numeric conversion would lose information
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> T convertScalar(Object value, Class<T> target) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot convert null to " + target.getSimpleName());
        }
        if (target.isInstance(value)) {
            return target.cast(value);
        }
        if (Number.class.isAssignableFrom(target)) {
            return target.cast(convertNumber(toBigDecimal(value), target));
        }
        if (target == Boolean.class) {
            String text = value.toString().trim().toLowerCase(Locale.ROOT);
            if (!text.equals("true") && !text.equals("false")) {
                throw new IllegalArgumentException("Value " + value + " is not a boolean");
            }
            return target.cast(Boolean.valueOf(text));
        }
        if (target == Character.class) {
            String text = value.toString();
            if (text.length() != 1) {
                throw new IllegalArgumentException("Value " + value + " is not a single character");
            }
            return target.cast(text.charAt(0));
        }
        if (target.isEnum()) {
            return (T) Enum.valueOf((Class<? extends Enum>) target, value.toString().trim());
        }
        throw new IllegalArgumentException(
            "No conversion from " + value.getClass().getSimpleName() + " to " + target.getSimpleName());
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof CharSequence) {
            return new BigDecimal(value.toString().trim());
        }
        throw new IllegalArgumentException("Value " + value + " is not numeric");
    }

    private static Number convertNumber(BigDecimal decimal, Class<?> target) {
        if (target == Integer.class) {
            return decimal.intValueExact();
        }
        if (target == Long.class) {
            return decimal.longValueExact();
        }
        if (target == Short.class) {
            return decimal.shortValueExact();
        }
        if (target == Byte.class) {
            return decimal.byteValueExact();
        }
        if (target == BigInteger.class) {
            return decimal.toBigIntegerExact();
        }
        if (target == Double.class) {
            return decimal.doubleValue();
        }
        if (target == Float.class) {
            return decimal.floatValue();
        }
        if (target == BigDecimal.class || target == Number.class) {
            return decimal;
        }
        throw new IllegalArgumentException("Unsupported numeric type " + target.getSimpleName());
    }

    private static Map<String, String> buildJsonTypeLabels() {
        Map<String, String> labels = new HashMap<>();
        for (String name : List.of("Integer", "int", "Long", "long", "Short", "short", "Byte", "byte",
            "BigInteger", "Double", "double", "Float", "float", "BigDecimal", "Number")) {
            labels.put(name, JSON_NUMBER);
        }
        for (String name : List.of("String", "Character", "char", "LocalDate", "LocalDateTime",
            "OffsetDateTime", "TextNode")) {
            labels.put(name, JSON_STRING);
        }
        labels.put("Boolean", JSON_BOOLEAN);
        labels.put("boolean", JSON_BOOLEAN);
        for (String name : List.of("Map", "HashMap", "LinkedHashMap", "ObjectNode")) {
            labels.put(name, JSON_OBJECT);
        }
        for (String name : List.of("List", "ArrayList", "Collection", "Set", "Iterable", "ArrayNode")) {
            labels.put(name, JSON_ARRAY);
        }
        labels.put("JsonNode", "Json Value");
        labels.put("Object", "Json Value");
        return Map.copyOf(labels);
    }
}

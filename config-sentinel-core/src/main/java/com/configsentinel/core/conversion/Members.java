package com.configsentinel.core.conversion;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reflective access to the named members of Java records and plain objects.
 *
 * <p>Records expose their components in declaration order. Other classes expose their
 * non-static, non-synthetic fields, superclass fields first.
 */
public final class Members {

    private Members() {
        // Utility class - prevent instantiation
    }

    /**
     * Lists the member names of an object.
     *
     * @param target object to inspect
     * @return member names in declaration order
     */
    public static List<String> names(Object target) {
        Class<?> type = target.getClass();
        if (type.isRecord()) {
            return List.of(type.getRecordComponents()).stream()
                .map(RecordComponent::getName)
                .toList();
        }
        return instanceFields(type).stream()
            .map(Field::getName)
            .toList();
    }

    /**
     * Checks whether an object has a member with the given name.
     *
     * @param target object to inspect
     * @param name member name
     * @return true if the member exists
     */
    public static boolean has(Object target, String name) {
        return names(target).contains(name);
    }

    /**
     * Reads a member value.
     *
     * @param target object to read from
     * @param name member name
     * @return member value, possibly null
     * @throws IllegalArgumentException if no such member exists
     */
    public static Object get(Object target, String name) {
        Class<?> type = target.getClass();
        try {
            if (type.isRecord()) {
                Method accessor = component(type, name).getAccessor();
                accessor.setAccessible(true);
                return accessor.invoke(target);
            }
            Field field = field(type, name);
            field.setAccessible(true);
            return field.get(target);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read member " + name + " of " + type.getName(), e);
        }
    }

    /**
     * Returns the declared type of a member.
     *
     * @param target object to inspect
     * @param name member name
     * @return declared member type
     * @throws IllegalArgumentException if no such member exists
     */
    public static Class<?> type(Object target, String name) {
        Class<?> type = target.getClass();
        if (type.isRecord()) {
            return component(type, name).getType();
        }
        return field(type, name).getType();
    }

    /**
     * Writes a member value.
     *
     * @param target object to write to
     * @param name member name
     * @param value new value
     * @throws UnsupportedOperationException if the target is a record or the member is final
     * @throws IllegalArgumentException if no such member exists or the value has the wrong type
     */
    public static void set(Object target, String name, Object value) {
        Class<?> type = target.getClass();
        if (type.isRecord()) {
            throw new UnsupportedOperationException(
                "Cannot set member " + name + " on record " + type.getName() + ": records are immutable");
        }
        Field field = field(type, name);
        if (Modifier.isFinal(field.getModifiers())) {
            throw new UnsupportedOperationException(
                "Cannot set final member " + name + " on " + type.getName());
        }
        try {
            field.setAccessible(true);
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write member " + name + " of " + type.getName(), e);
        }
    }

    /**
     * Checks whether a value should be walked member by member rather than treated as a leaf.
     *
     * <p>Records and objects of non-JDK classes are structured; JDK types (strings, numbers,
     * temporals, collections, maps) and enums are not.
     *
     * @param value value to check
     * @return true if the value is a structured record or plain object
     */
    public static boolean isStructured(Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof Iterable<?>
            || value instanceof Optional<?> || value instanceof Enum<?> || value.getClass().isArray()) {
            return false;
        }
        Class<?> type = value.getClass();
        if (type.isRecord()) {
            return true;
        }
        String className = type.getName();
        return !type.isPrimitive()
            && !className.startsWith("java.")
            && !className.startsWith("javax.")
            && !className.startsWith("com.fasterxml.jackson.");
    }

    private static RecordComponent component(Class<?> type, String name) {
        for (RecordComponent component : type.getRecordComponents()) {
            if (component.getName().equals(name)) {
                return component;
            }
        }
        throw new IllegalArgumentException("Record " + type.getName() + " has no component named " + name);
    }

    private static Field field(Class<?> type, String name) {
        for (Field field : instanceFields(type)) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Class " + type.getName() + " has no member named " + name);
    }

    private static List<Field> instanceFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }
        return hierarchy.stream()
            .flatMap(current -> List.of(current.getDeclaredFields()).stream())
            .filter(field -> !Modifier.isStatic(field.getModifiers()) && !field.isSynthetic())
            .toList();
    }
}

package com.configsentinel.core.translator;

import com.configsentinel.core.conversion.ValueType;

import java.util.List;
import java.util.Optional;

/**
 * Adapter that lets a {@link com.configsentinel.core.schema.Schema} read and write one physical
 * representation of "a collection of named values".
 *
 * <p>Implementations exist for Jackson JSON trees, string-keyed maps and Java records/objects.
 * Every implementation must give callers the same cast results for equivalent data; only the
 * string rendering of raw values may differ.
 *
 * <p>Translators hold no state about the collections they operate on, so one instance can be
 * shared across validations and threads.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PropertiesTranslator extends AbstractTranslator<Properties> {
 *     @Override
 *     public boolean collectionContains(Properties collection, String key) {
 *         return collection.containsKey(key);
 *     }
 *     ...
 * }
 * }</pre>
 *
 * @param <C> backing collection type
 * @see com.configsentinel.core.translator.base.AbstractTranslator
 */
public interface Translator<C> {

    /**
     * Checks whether a value is present under {@code key}. Never throws for absent keys.
     *
     * @param collection collection to search
     * @param key value name
     * @return true if the collection holds a value (possibly null) under the key
     */
    boolean collectionContains(C collection, String key);

    /**
     * Lists all keys of the collection in its natural order.
     *
     * @param collection collection to inspect
     * @return keys of the collection
     * @throws UnsupportedOperationException if the collection has no stable key concept
     */
    List<String> getCollectionKeys(C collection);

    /**
     * Renders the value under {@code key} as text for diagnostics. Assumes the key exists.
     *
     * @param collection collection to read
     * @param key value name
     * @return best-effort string rendering
     */
    String collectionValueToString(C collection, String key);

    /**
     * Checks whether the value under {@code key} is absent, null, a blank string, an empty
     * array or an empty object.
     *
     * @param collection collection to read
     * @param key value name
     * @return true if the value is null or empty
     */
    boolean fieldValueIsNullOrEmpty(C collection, String key);

    /**
     * Attempts to coerce the value under {@code key} into {@code type}.
     *
     * <p>Rules are applied in order: identity, string rendering, date/time parsing through the
     * registered formats, structured (member-by-member) conversion, element-wise sequence
     * conversion, and finally scalar conversion. Never throws.
     *
     * @param collection collection to read
     * @param key value name
     * @param type target type
     * @param <T> target type
     * @return cast value, or empty if the cast failed
     */
    <T> Optional<T> tryCastValue(C collection, String key, ValueType<T> type);

    /**
     * Writes {@code value} under {@code key}, creating the key if absent.
     *
     * @param collection collection to modify in place
     * @param key value name
     * @param value value to store
     * @param <T> value type
     * @throws UnsupportedOperationException if the collection cannot be modified
     */
    <T> void insertFieldValue(C collection, String key, T value);

    /**
     * Maps a Java type name to the external type label used in diagnostics.
     *
     * @param nativeTypeName simple Java type name, e.g. {@code Integer}
     * @return external label, e.g. {@code Json Number}
     */
    String getEquivalentType(String nativeTypeName);
}

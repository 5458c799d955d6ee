package com.configsentinel.core.translator.impl;

import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.conversion.Members;
import com.configsentinel.core.translator.base.AbstractTranslator;

import java.util.List;

/**
 * Translator for Java records and plain objects, read through reflection.
 *
 * <p>Keys are record component names, or the instance field names of other classes.
 * Records are immutable: inserting into one fails with {@link UnsupportedOperationException},
 * as does inserting into a final field. Mutable objects are updated in place.
 *
 * <p>Scalars such as strings and numbers have no members; asking them for keys fails with
 * {@link UnsupportedOperationException}.
 */
public class RecordTranslator extends AbstractTranslator<Object> {

    public RecordTranslator() {
        super();
    }

    public RecordTranslator(DateTimeFormats dateTimeFormats) {
        super(dateTimeFormats);
    }

    @Override
    public boolean collectionContains(Object collection, String key) {
        return Members.isStructured(collection) && Members.has(collection, key);
    }

    @Override
    public List<String> getCollectionKeys(Object collection) {
        requireStructured(collection);
        return Members.names(collection);
    }

    @Override
    protected Object rawValue(Object collection, String key) {
        return Members.get(collection, key);
    }

    @Override
    public <T> void insertFieldValue(Object collection, String key, T value) {
        requireStructured(collection);
        Members.set(collection, key, value);
    }

    private static void requireStructured(Object collection) {
        if (!Members.isStructured(collection)) {
            String type = collection == null ? "null" : collection.getClass().getName();
            throw new UnsupportedOperationException("Value of type " + type + " has no named members");
        }
    }
}

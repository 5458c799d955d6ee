package com.configsentinel.core.translator.impl;

import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.translator.base.AbstractTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translator for string-keyed maps of arbitrary values.
 *
 * <p>Values may be any Java object, including nested maps, lists, records and JSON nodes.
 * Listing the keys of, or inserting into, a null or unmodifiable map fails with
 * {@link UnsupportedOperationException}.
 */
public class MapTranslator extends AbstractTranslator<Map<String, Object>> {

    public MapTranslator() {
        super();
    }

    public MapTranslator(DateTimeFormats dateTimeFormats) {
        super(dateTimeFormats);
    }

    @Override
    public boolean collectionContains(Map<String, Object> collection, String key) {
        return collection != null && collection.containsKey(key);
    }

    @Override
    public List<String> getCollectionKeys(Map<String, Object> collection) {
        requireMap(collection);
        return new ArrayList<>(collection.keySet());
    }

    @Override
    protected Object rawValue(Map<String, Object> collection, String key) {
        return collection.get(key);
    }

    @Override
    public <T> void insertFieldValue(Map<String, Object> collection, String key, T value) {
        requireMap(collection);
        try {
            collection.put(key, value);
        } catch (UnsupportedOperationException e) {
            throw new UnsupportedOperationException("Cannot insert " + key + " into an unmodifiable map", e);
        }
    }

    private static void requireMap(Map<String, Object> collection) {
        if (collection == null) {
            throw new UnsupportedOperationException("Collection is null; expected a map of named values");
        }
    }
}

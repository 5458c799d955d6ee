package com.configsentinel.core.translator.impl;

import com.configsentinel.core.conversion.Conversions;
import com.configsentinel.core.conversion.DateTimeFormats;
import com.configsentinel.core.translator.base.AbstractTranslator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Translator for parsed Jackson JSON trees.
 *
 * <p>Only {@link ObjectNode}s have keys. Asking an array or scalar node for its keys, or
 * inserting into one, fails with {@link UnsupportedOperationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * JsonNode config = new ObjectMapper().readTree(json);
 * ValidationResult result = schema.validate(config, new JsonNodeTranslator());
 * }</pre>
 */
public class JsonNodeTranslator extends AbstractTranslator<JsonNode> {

    public JsonNodeTranslator() {
        super();
    }

    public JsonNodeTranslator(DateTimeFormats dateTimeFormats) {
        super(dateTimeFormats);
    }

    @Override
    public boolean collectionContains(JsonNode collection, String key) {
        return collection != null && collection.isObject() && collection.has(key);
    }

    @Override
    public List<String> getCollectionKeys(JsonNode collection) {
        if (collection == null || !collection.isObject()) {
            throw new UnsupportedOperationException(
                "JSON node of type " + nodeType(collection) + " has no keys; only JSON objects do");
        }
        List<String> keys = new ArrayList<>();
        collection.fieldNames().forEachRemaining(keys::add);
        return keys;
    }

    @Override
    protected Object rawValue(JsonNode collection, String key) {
        return collection.get(key);
    }

    @Override
    public <T> void insertFieldValue(JsonNode collection, String key, T value) {
        if (!(collection instanceof ObjectNode object)) {
            throw new UnsupportedOperationException(
                "Cannot insert " + key + " into JSON node of type " + nodeType(collection));
        }
        object.set(key, Conversions.toNode(value));
    }

    private static String nodeType(JsonNode node) {
        return node == null ? "null" : node.getNodeType().toString();
    }
}

package com.currencyunits.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Keyed coder backed by a Jackson object node.
 * A field holding anything other than a JSON string reads as absent.
 */
public class JsonKeyedCoder implements KeyedEncoder, KeyedDecoder {

    private final ObjectNode node;

    public JsonKeyedCoder() {
        this(JsonNodeFactory.instance.objectNode());
    }

    public JsonKeyedCoder(ObjectNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Node cannot be null");
        }
        this.node = node;
    }

    @Override
    public void setString(String key, String value) {
        node.put(key, value);
    }

    @Override
    public Optional<String> getString(String key) {
        JsonNode field = node.get(key);
        if (field == null || !field.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(field.textValue());
    }

    public ObjectNode getNode() {
        return node;
    }
}

package com.currencyunits.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory keyed coder. Fields keep their insertion order.
 */
public class MapKeyedCoder implements KeyedEncoder, KeyedDecoder {

    private final Map<String, String> fields = new LinkedHashMap<>();

    public MapKeyedCoder() {
    }

    public MapKeyedCoder(Map<String, String> fields) {
        this.fields.putAll(fields);
    }

    @Override
    public void setString(String key, String value) {
        fields.put(key, value);
    }

    @Override
    public Optional<String> getString(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }
}

package com.currencyunits.codec;

import java.util.Optional;

/**
 * Read side of a keyed serialization backend.
 */
public interface KeyedDecoder {

    /**
     * @param key the field name
     * @return the string stored under the key, or empty if the field is absent
     */
    Optional<String> getString(String key);
}

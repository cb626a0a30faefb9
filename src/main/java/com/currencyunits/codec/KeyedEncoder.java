package com.currencyunits.codec;

/**
 * Write side of a keyed serialization backend.
 */
public interface KeyedEncoder {

    void setString(String key, String value);
}

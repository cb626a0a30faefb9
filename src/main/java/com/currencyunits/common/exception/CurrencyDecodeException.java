package com.currencyunits.common.exception;

/**
 * Thrown when persisted data does not name a known currency.
 */
public class CurrencyDecodeException extends CurrencyUnitsException {

    private final String encodedCode;

    public CurrencyDecodeException(String encodedCode) {
        super("Cannot decode currency unit from code: " + encodedCode);
        this.encodedCode = encodedCode;
    }

    public String getEncodedCode() {
        return encodedCode;
    }
}

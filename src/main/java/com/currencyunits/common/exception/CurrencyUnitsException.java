package com.currencyunits.common.exception;

/**
 * Base exception for all currency unit exceptions.
 */
public class CurrencyUnitsException extends RuntimeException {

    public CurrencyUnitsException(String message) {
        super(message);
    }
}

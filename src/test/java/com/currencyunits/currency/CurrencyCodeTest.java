package com.currencyunits.currency;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyCodeTest {

    @Test
    void testFromStringMatchesEveryCode() {
        for (CurrencyCode code : CurrencyCode.values()) {
            assertEquals(code, CurrencyCode.fromString(code.name()).orElseThrow());
        }
    }

    @Test
    void testFromStringRejectsUnknownCodes() {
        assertTrue(CurrencyCode.fromString("XXX").isEmpty());
        assertTrue(CurrencyCode.fromString("").isEmpty());
        assertTrue(CurrencyCode.fromString(null).isEmpty());
    }

    @Test
    void testFromStringIsCaseSensitive() {
        assertTrue(CurrencyCode.fromString("eur").isEmpty());
        assertTrue(CurrencyCode.fromString(" EUR").isEmpty());
    }
}

package com.currencyunits.currency;

import java.util.Optional;

/**
 * ISO 4217 style codes of the currencies in the catalog.
 * The constant name is the persisted form of a currency.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    RUR,
    JPY,
    AUD,
    CAD,
    AMD;

    /**
     * Resolves a persisted code string. Matching is exact and case-sensitive.
     *
     * @param value the code string, may be null
     * @return the matching code, or empty if the string names no known currency
     */
    public static Optional<CurrencyCode> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CurrencyCode code : values()) {
            if (code.name().equals(value)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}

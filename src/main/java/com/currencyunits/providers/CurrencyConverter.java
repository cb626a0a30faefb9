package com.currencyunits.providers;

import com.currencyunits.currency.CurrencyUnit;
import com.currencyunits.measurement.Measurement;

/**
 * Converts monetary amounts between currencies.
 *
 * Implementations work from the coefficients carried by the units; no rates
 * are fetched from outside.
 */
public interface CurrencyConverter {

    /**
     * Get the exchange rate from one currency to another.
     *
     * @param from source currency
     * @param to target currency
     * @return amount of {@code to} equal to one unit of {@code from}
     */
    double getExchangeRate(CurrencyUnit from, CurrencyUnit to);

    /**
     * Convert an amount to another currency.
     *
     * @param amount the amount to convert, left unchanged
     * @param to target currency
     * @return a new measurement in the target currency, valued at the amount
     *     times {@link #getExchangeRate(CurrencyUnit, CurrencyUnit)}
     */
    Measurement<CurrencyUnit> convert(Measurement<CurrencyUnit> amount, CurrencyUnit to);
}

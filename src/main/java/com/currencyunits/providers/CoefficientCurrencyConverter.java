package com.currencyunits.providers;

import com.currencyunits.currency.CurrencyUnit;
import com.currencyunits.measurement.Measurement;
import lombok.extern.slf4j.Slf4j;

/**
 * Currency converter driven by the catalog coefficients (base: USD).
 */
@Slf4j
public class CoefficientCurrencyConverter implements CurrencyConverter {

    @Override
    public double getExchangeRate(CurrencyUnit from, CurrencyUnit to) {
        if (from.equals(to)) {
            return 1.0;
        }

        double rate = from.getCoefficient() / to.getCoefficient();
        log.debug("FX rate {} -> {}: {}", from.getCode(), to.getCode(), rate);
        return rate;
    }

    @Override
    public Measurement<CurrencyUnit> convert(Measurement<CurrencyUnit> amount, CurrencyUnit to) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }

        if (to == null) {
            throw new IllegalArgumentException("Target currency cannot be null");
        }

        double rate = getExchangeRate(amount.getUnit(), to);
        Measurement<CurrencyUnit> converted = Measurement.of(amount.getValue() * rate, to);
        log.debug("Converted {} to {}", amount, converted);
        return converted;
    }
}

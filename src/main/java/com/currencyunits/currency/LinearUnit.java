package com.currencyunits.currency;

/**
 * A unit of measure convertible to its base unit by a single scale factor.
 *
 * @param <U> the unit family
 */
public interface LinearUnit<U extends LinearUnit<U>> {

    String getSymbol();

    /**
     * How many base units one unit of this unit equals.
     */
    double getCoefficient();

    /**
     * The pivot unit every conversion in this family goes through.
     */
    U baseUnit();
}

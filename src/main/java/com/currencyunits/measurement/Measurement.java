package com.currencyunits.measurement;

import com.currencyunits.currency.LinearUnit;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A numeric value paired with a unit.
 *
 * Conversion rescales the value in place through the unit family's base unit.
 *
 * @param <U> the unit family
 */
@Getter
@EqualsAndHashCode
public class Measurement<U extends LinearUnit<U>> {

    private double value;

    private U unit;

    @JsonCreator
    public Measurement(@JsonProperty("value") double value, @JsonProperty("unit") U unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Unit cannot be null");
        }
        this.value = value;
        this.unit = unit;
    }

    public static <U extends LinearUnit<U>> Measurement<U> of(double value, U unit) {
        return new Measurement<>(value, unit);
    }

    /**
     * Converts this measurement to another unit of the same family.
     * An equal target unit leaves the value untouched.
     *
     * @param target the unit to convert to
     * @throws IllegalArgumentException if the target is null or has a different base unit
     */
    public void convert(U target) {
        if (target == null) {
            throw new IllegalArgumentException("Target unit cannot be null");
        }
        if (!unit.equals(target)) {
            if (!unit.baseUnit().equals(target.baseUnit())) {
                throw new IllegalArgumentException(
                    String.format("Cannot convert between units with different base units: %s and %s",
                        unit.baseUnit(), target.baseUnit())
                );
            }
            double baseValue = value * unit.getCoefficient();
            value = baseValue / target.getCoefficient();
        }
        unit = target;
    }

    /**
     * Returns a converted copy, leaving this measurement unchanged.
     */
    public Measurement<U> converted(U target) {
        Measurement<U> copy = new Measurement<>(value, unit);
        copy.convert(target);
        return copy;
    }

    @Override
    public String toString() {
        return value + " " + unit.getSymbol();
    }
}

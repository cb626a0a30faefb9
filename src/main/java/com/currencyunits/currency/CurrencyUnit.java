package com.currencyunits.currency;

import com.currencyunits.codec.KeyedDecoder;
import com.currencyunits.codec.KeyedEncoder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A unit of measure for money.
 *
 * Each currency converts to the base currency ({@link #USD}) by a single
 * coefficient: one unit of the currency equals {@code coefficient} US dollars.
 * Instances are immutable; the catalog constants are built once and shared.
 *
 * Two currencies are equal when their {@code code} and {@code symbol} match.
 * The coefficient takes no part in equality, so creating a second currency
 * with the code and symbol of a catalog constant but another coefficient
 * gives a unit that equals the constant yet converts differently. Conversions
 * between such units are undefined.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class CurrencyUnit implements LinearUnit<CurrencyUnit> {

    /** Field name of the persisted code. */
    public static final String CODE_KEY = "code";

    /** United States dollar, the base currency. */
    public static final CurrencyUnit USD = new CurrencyUnit("$", CurrencyCode.USD, 1.0);

    /** Euro. */
    public static final CurrencyUnit EUR = new CurrencyUnit("€", CurrencyCode.EUR, 1.123349);

    /** Pound sterling. */
    public static final CurrencyUnit GBP = new CurrencyUnit("£", CurrencyCode.GBP, 1.25025);

    /** Russian ruble. */
    public static final CurrencyUnit RUR = new CurrencyUnit("₽", CurrencyCode.RUR, 0.01587);

    /** Japanese yen. */
    public static final CurrencyUnit JPY = new CurrencyUnit("¥", CurrencyCode.JPY, 0.009283);

    /** Australian dollar. */
    public static final CurrencyUnit AUD = new CurrencyUnit("A$", CurrencyCode.AUD, 0.7042);

    /** Canadian dollar. */
    public static final CurrencyUnit CAD = new CurrencyUnit("C$", CurrencyCode.CAD, 0.764905);

    /** Armenian dram. */
    public static final CurrencyUnit AMD = new CurrencyUnit("֏", CurrencyCode.AMD, 0.00209872);

    private static final List<CurrencyUnit> CATALOG = List.of(USD, EUR, GBP, RUR, JPY, AUD, CAD, AMD);

    private static final Map<CurrencyCode, CurrencyUnit> BY_CODE = new EnumMap<>(CurrencyCode.class);

    static {
        for (CurrencyUnit unit : CATALOG) {
            BY_CODE.put(unit.code, unit);
        }
    }

    @EqualsAndHashCode.Include
    private final String symbol;

    @EqualsAndHashCode.Include
    private final CurrencyCode code;

    private final double coefficient;

    /**
     * Creates a currency. Arguments are not validated: a blank symbol or a
     * non-positive coefficient is accepted and yields meaningless conversions.
     *
     * @param symbol the symbol used to display the currency
     * @param code the currency code
     * @param coefficient amount of the base currency equal to one unit of this currency
     */
    public CurrencyUnit(String symbol, CurrencyCode code, double coefficient) {
        this.symbol = symbol;
        this.code = code;
        this.coefficient = coefficient;
    }

    /**
     * The catalog constant for a code.
     */
    public static CurrencyUnit of(CurrencyCode code) {
        return BY_CODE.get(code);
    }

    /**
     * All catalog constants, base currency first.
     */
    public static List<CurrencyUnit> catalog() {
        return CATALOG;
    }

    /**
     * Always {@link #USD}.
     */
    @Override
    public CurrencyUnit baseUnit() {
        return USD;
    }

    /**
     * Writes the code under {@link #CODE_KEY}. Symbol and coefficient are not
     * written; they come back from the catalog on decode.
     */
    public void encode(KeyedEncoder encoder) {
        encoder.setString(CODE_KEY, code.name());
    }

    /**
     * Reads a currency written by {@link #encode(KeyedEncoder)}.
     *
     * @return the catalog constant for the stored code, or empty if the code
     *     field is missing or names no known currency
     */
    public static Optional<CurrencyUnit> decode(KeyedDecoder decoder) {
        return decoder.getString(CODE_KEY)
            .flatMap(CurrencyCode::fromString)
            .map(CurrencyUnit::of);
    }
}

package com.currencyunits.persistence;

import com.currencyunits.codec.MapKeyedCoder;
import com.currencyunits.common.exception.CurrencyDecodeException;
import com.currencyunits.currency.CurrencyUnit;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Stores a currency unit as its code in a single column.
 *
 * Loading resolves the catalog constant for the stored code, so symbol and
 * coefficient always come from the catalog.
 *
 * Auto-applied to every {@code CurrencyUnit} attribute once the persistence
 * unit scans this package, e.g. through {@code @EntityScan}. Entities mapped
 * without that scan name the converter with {@code @Convert}.
 */
@Converter(autoApply = true)
@Slf4j
public class CurrencyUnitAttributeConverter implements AttributeConverter<CurrencyUnit, String> {

    @Override
    public String convertToDatabaseColumn(CurrencyUnit attribute) {
        if (attribute == null) {
            return null;
        }
        MapKeyedCoder coder = new MapKeyedCoder();
        attribute.encode(coder);
        return coder.getString(CurrencyUnit.CODE_KEY).orElse(null);
    }

    @Override
    public CurrencyUnit convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return CurrencyUnit.decode(new MapKeyedCoder(Map.of(CurrencyUnit.CODE_KEY, dbData)))
            .orElseThrow(() -> {
                log.warn("Rejected persisted currency code {}", dbData);
                return new CurrencyDecodeException(dbData);
            });
    }
}

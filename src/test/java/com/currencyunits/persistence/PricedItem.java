package com.currencyunits.persistence;

import com.currencyunits.currency.CurrencyUnit;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity carrying a currency column, used to exercise the attribute converter.
 */
@Entity
@Table(name = "priced_items")
@Data
@NoArgsConstructor
public class PricedItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    private double amount;

    @Convert(converter = CurrencyUnitAttributeConverter.class)
    @Column(name = "currency", length = 3)
    private CurrencyUnit currency;

    public PricedItem(String name, double amount, CurrencyUnit currency) {
        this.name = name;
        this.amount = amount;
        this.currency = currency;
    }
}

package com.currencyunits.persistence;

import com.currencyunits.currency.CurrencyUnit;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity whose currency column relies on the auto-applied converter.
 */
@Entity
@Table(name = "tariffs")
@Data
@NoArgsConstructor
public class Tariff {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private double fee;

    private CurrencyUnit currency;

    public Tariff(double fee, CurrencyUnit currency) {
        this.fee = fee;
        this.currency = currency;
    }
}

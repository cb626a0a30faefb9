package com.currencyunits.config;

import com.currencyunits.codec.CurrencyUnitModule;
import com.currencyunits.providers.CoefficientCurrencyConverter;
import com.currencyunits.providers.CurrencyConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Registers the currency converter and the currency unit JSON module.
 *
 * Set {@code currency-units.jackson.enabled=false} to keep the module out of
 * the application's ObjectMapper.
 */
@AutoConfiguration(before = JacksonAutoConfiguration.class)
@Slf4j
public class CurrencyUnitsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CurrencyConverter currencyConverter() {
        log.info("Registering coefficient based currency converter");
        return new CoefficientCurrencyConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "currency-units.jackson", name = "enabled", matchIfMissing = true)
    public CurrencyUnitModule currencyUnitModule() {
        return new CurrencyUnitModule();
    }
}

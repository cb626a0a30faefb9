package com.currencyunits.config;

import com.currencyunits.currency.CurrencyUnit;
import com.currencyunits.measurement.Measurement;
import com.currencyunits.providers.CurrencyConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the auto-configured beans in a Boot application.
 */
@SpringBootTest
@ActiveProfiles("test")
class CurrencyUnitsIntegrationTest {

    @Autowired
    private CurrencyConverter currencyConverter;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void testApplicationObjectMapperWritesCurrencyCodes() throws Exception {
        assertEquals("{\"code\":\"CAD\"}", objectMapper.writeValueAsString(CurrencyUnit.CAD));
        assertSame(CurrencyUnit.CAD, objectMapper.readValue("{\"code\":\"CAD\"}", CurrencyUnit.class));
    }

    @Test
    void testConvertsRequestPayload() throws Exception {
        Measurement<CurrencyUnit> amount = objectMapper.readValue(
            "{\"value\":500.0,\"unit\":{\"code\":\"AMD\"}}",
            new TypeReference<Measurement<CurrencyUnit>>() { });

        Measurement<CurrencyUnit> usd = currencyConverter.convert(amount, CurrencyUnit.USD);

        assertEquals(500.0 * 0.00209872, usd.getValue());
        assertEquals("{\"value\":" + (500.0 * 0.00209872) + ",\"unit\":{\"code\":\"USD\"}}",
            objectMapper.writeValueAsString(usd));
    }
}

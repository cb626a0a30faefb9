package com.currencyunits.codec;

import com.currencyunits.currency.CurrencyUnit;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Optional;

/**
 * Jackson module writing a {@link CurrencyUnit} as {@code {"code":"EUR"}}.
 *
 * Reading resolves the catalog constant for the code. A payload without a
 * string code fails with {@link com.fasterxml.jackson.databind.exc.MismatchedInputException};
 * an unknown code fails with {@link InvalidFormatException}.
 */
public class CurrencyUnitModule extends SimpleModule {

    public CurrencyUnitModule() {
        super("CurrencyUnitModule");
        addSerializer(CurrencyUnit.class, new CurrencyUnitSerializer());
        addDeserializer(CurrencyUnit.class, new CurrencyUnitDeserializer());
    }

    static class CurrencyUnitSerializer extends StdSerializer<CurrencyUnit> {

        CurrencyUnitSerializer() {
            super(CurrencyUnit.class);
        }

        @Override
        public void serialize(CurrencyUnit value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            JsonKeyedCoder coder = new JsonKeyedCoder();
            value.encode(coder);
            provider.defaultSerializeValue(coder.getNode(), gen);
        }
    }

    static class CurrencyUnitDeserializer extends StdDeserializer<CurrencyUnit> {

        CurrencyUnitDeserializer() {
            super(CurrencyUnit.class);
        }

        @Override
        public CurrencyUnit deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(CurrencyUnit.class,
                    "Currency unit must be a JSON object with a \"" + CurrencyUnit.CODE_KEY + "\" field");
            }
            JsonKeyedCoder coder = new JsonKeyedCoder((ObjectNode) node);
            Optional<String> code = coder.getString(CurrencyUnit.CODE_KEY);
            if (code.isEmpty()) {
                return ctxt.reportInputMismatch(CurrencyUnit.class,
                    "Currency unit needs a string \"" + CurrencyUnit.CODE_KEY + "\" field");
            }
            return CurrencyUnit.decode(coder)
                .orElseThrow(() -> InvalidFormatException.from(p,
                    "Unknown currency code: " + code.get(), code.get(), CurrencyUnit.class));
        }
    }
}

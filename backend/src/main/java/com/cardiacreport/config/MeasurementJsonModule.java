package com.cardiacreport.config;

import com.cardiacreport.util.MeasurementParser;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Lenient number handling for measurement payloads. Decimal commas are accepted;
 * blank or unparsable values become null instead of failing the request.
 */
public class MeasurementJsonModule extends SimpleModule {

    public MeasurementJsonModule() {
        super("MeasurementJsonModule");
        addDeserializer(Double.class, new LenientDoubleDeserializer());
        addDeserializer(Integer.class, new LenientIntegerDeserializer());
    }

    static class LenientDoubleDeserializer extends JsonDeserializer<Double> {
        @Override
        public Double deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                return parser.getDoubleValue();
            }
            if (token == JsonToken.VALUE_STRING) {
                return MeasurementParser.parseDouble(parser.getText());
            }
            if (token == JsonToken.START_ARRAY || token == JsonToken.START_OBJECT) {
                parser.skipChildren();
            }
            return null;
        }

        @Override
        public Double getNullValue(DeserializationContext context) {
            return null;
        }
    }

    static class LenientIntegerDeserializer extends JsonDeserializer<Integer> {
        @Override
        public Integer deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT
                || token == JsonToken.VALUE_STRING) {
                return MeasurementParser.parseInteger(parser.getText());
            }
            if (token == JsonToken.START_ARRAY || token == JsonToken.START_OBJECT) {
                parser.skipChildren();
            }
            return null;
        }
    }
}

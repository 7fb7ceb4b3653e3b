package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.ShapeType;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.Locale;

/**
 * Lenient reader for a declared table shape. Accepts "wide", "long" and "tall" in any case;
 * null, blank, "auto" and empty containers mean "let detection decide".
 */
public class ShapeTypeDeserializer extends JsonDeserializer<ShapeType> {

    @Override
    public ShapeType deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.getCurrentToken();

        if (token == JsonToken.VALUE_NULL) {
            return null;
        }

        // {} or [] from form builders
        if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
            parser.skipChildren();
            return null;
        }

        if (token != JsonToken.VALUE_STRING) {
            return (ShapeType) context.handleUnexpectedToken(ShapeType.class, parser);
        }

        String value = parser.getText().trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "":
            case "auto":
            case "ambiguous":
                return null;
            case "wide":
                return ShapeType.WIDE;
            case "long":
            case "tall":
                return ShapeType.LONG;
            default:
                return (ShapeType) context.handleWeirdStringValue(ShapeType.class, parser.getText(),
                        "expected one of: wide, long, tall, auto");
        }
    }
}

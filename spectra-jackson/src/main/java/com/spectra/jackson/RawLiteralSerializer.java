package com.spectra.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.spectra.ast.RawLiteral;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes a literal payload as {@code {"kind": ..., "value": ...}}.
 * Integers are written as unsigned decimal numbers, so values above {@link Long#MAX_VALUE}
 * do not come out negative.
 */
public class RawLiteralSerializer extends StdSerializer<RawLiteral> {

    public RawLiteralSerializer() {
        super(RawLiteral.class);
    }

    @Override
    public void serialize(RawLiteral value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (value instanceof RawLiteral.IntegerValue integer) {
            gen.writeStringField("kind", "integer");
            gen.writeFieldName("value");
            writeUnsigned(gen, integer.value());
        } else if (value instanceof RawLiteral.FloatValue number) {
            gen.writeStringField("kind", "float");
            gen.writeNumberField("value", number.value());
        } else if (value instanceof RawLiteral.StringValue string) {
            gen.writeStringField("kind", "string");
            gen.writeStringField("value", string.value());
        } else if (value instanceof RawLiteral.CharValue character) {
            gen.writeStringField("kind", "char");
            gen.writeStringField("value", Character.toString(character.codePoint()));
        } else if (value instanceof RawLiteral.BoolValue bool) {
            gen.writeStringField("kind", "bool");
            gen.writeBooleanField("value", bool.value());
        }
        gen.writeEndObject();
    }

    static void writeUnsigned(JsonGenerator gen, long value) throws IOException {
        if (value >= 0) {
            gen.writeNumber(value);
        } else {
            gen.writeNumber(new BigInteger(Long.toUnsignedString(value)));
        }
    }
}

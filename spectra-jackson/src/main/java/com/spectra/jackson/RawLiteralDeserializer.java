package com.spectra.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.spectra.ast.RawLiteral;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Reads the {@code {"kind": ..., "value": ...}} form written by {@link RawLiteralSerializer}.
 */
public class RawLiteralDeserializer extends StdDeserializer<RawLiteral> {

    private static final BigInteger UNSIGNED_LIMIT = BigInteger.ONE.shiftLeft(64);

    public RawLiteralDeserializer() {
        super(RawLiteral.class);
    }

    @Override
    public RawLiteral deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        String kind = node.path("kind").asText();
        JsonNode value = node.path("value");

        switch (kind) {
            case "integer":
                return new RawLiteral.IntegerValue(readUnsigned(value, this, ctxt));
            case "float":
                if (!value.isNumber()) {
                    return ctxt.reportInputMismatch(this, "Float literal value must be a number, got %s", value);
                }
                return new RawLiteral.FloatValue(value.doubleValue());
            case "string":
                if (!value.isTextual()) {
                    return ctxt.reportInputMismatch(this, "String literal value must be a string, got %s", value);
                }
                return new RawLiteral.StringValue(value.textValue());
            case "char":
                return new RawLiteral.CharValue(readCodePoint(value, this, ctxt));
            case "bool":
                if (!value.isBoolean()) {
                    return ctxt.reportInputMismatch(this, "Bool literal value must be a boolean, got %s", value);
                }
                return new RawLiteral.BoolValue(value.booleanValue());
            default:
                return ctxt.reportInputMismatch(this, "Unknown literal kind '%s'", kind);
        }
    }

    /**
     * Reads a JSON integer in {@code [0, 2^64)} into the bits of a {@code long}.
     */
    static long readUnsigned(JsonNode value, StdDeserializer<?> source, DeserializationContext ctxt) throws IOException {
        if (!value.isIntegralNumber()) {
            return ctxt.reportInputMismatch(source, "Integer value must be an integral number, got %s", value);
        }
        BigInteger big = value.bigIntegerValue();
        if (big.signum() < 0 || big.compareTo(UNSIGNED_LIMIT) >= 0) {
            return ctxt.reportInputMismatch(source, "Integer value %s is outside the unsigned 64-bit range", big);
        }
        return big.longValue();
    }

    static int readCodePoint(JsonNode value, StdDeserializer<?> source, DeserializationContext ctxt) throws IOException {
        String text = value.isTextual() ? value.textValue() : "";
        if (text.isEmpty() || text.codePointCount(0, text.length()) != 1) {
            return ctxt.reportInputMismatch(source, "Char value must be a single character, got %s", value);
        }
        return text.codePointAt(0);
    }
}

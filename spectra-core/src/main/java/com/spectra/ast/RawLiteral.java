package com.spectra.ast;

/**
 * Literal payloads lifted from literal tokens.
 */
public sealed interface RawLiteral permits
    RawLiteral.IntegerValue,
    RawLiteral.FloatValue,
    RawLiteral.StringValue,
    RawLiteral.CharValue,
    RawLiteral.BoolValue {

    /**
     * Unsigned 64-bit integer stored in the bits of a {@code long}.
     */
    record IntegerValue(long value) implements RawLiteral {
        @Override
        public String toString() {
            return "IntegerValue[value=" + Long.toUnsignedString(value) + "]";
        }
    }

    record FloatValue(double value) implements RawLiteral {}

    record StringValue(String value) implements RawLiteral {}

    record CharValue(int codePoint) implements RawLiteral {}

    record BoolValue(boolean value) implements RawLiteral {}
}

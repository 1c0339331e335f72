package com.spectra;

import java.util.Optional;

/**
 * The closed set of token kinds the lexer produces. Keywords and punctuation are
 * enums; every other kind carries its payload in a record.
 */
public sealed interface RawToken permits
    Keyword,
    Punctuation,
    RawToken.Identifier,
    RawToken.StringLiteral,
    RawToken.CharLiteral,
    RawToken.IntegerLiteral,
    RawToken.FloatLiteral,
    RawToken.BoolLiteral,
    RawToken.OversizedInteger,
    RawToken.UnexpectedChar {

    /**
     * Human-readable rendering used in parse error messages.
     */
    String describe();

    /**
     * Token for a reserved spelling: a keyword or one of the boolean literals.
     */
    static Optional<RawToken> reserved(String text) {
        switch (text) {
            case "true":
                return Optional.of(new BoolLiteral(true));
            case "false":
                return Optional.of(new BoolLiteral(false));
            default:
                return Keyword.fromSpelling(text).<RawToken>map(keyword -> keyword);
        }
    }

    record Identifier(String name) implements RawToken {
        @Override
        public String describe() {
            return "identifier `" + name + "`";
        }
    }

    record StringLiteral(String value) implements RawToken {
        @Override
        public String describe() {
            return "\"" + value + "\"";
        }
    }

    record CharLiteral(int codePoint) implements RawToken {
        @Override
        public String describe() {
            return "'" + Character.toString(codePoint) + "'";
        }
    }

    /**
     * Integer literal. The value is unsigned: digit runs up to 18446744073709551615 are
     * stored in the bits of a {@code long}.
     */
    record IntegerLiteral(long value) implements RawToken {
        @Override
        public String describe() {
            return Long.toUnsignedString(value);
        }
    }

    record FloatLiteral(double value) implements RawToken {
        @Override
        public String describe() {
            return Double.toString(value);
        }
    }

    record BoolLiteral(boolean value) implements RawToken {
        @Override
        public String describe() {
            return value ? "`true`" : "`false`";
        }
    }

    /**
     * A digit run too large for an unsigned 64-bit integer. No grammar rule accepts it.
     */
    record OversizedInteger(String digits) implements RawToken {
        @Override
        public String describe() {
            return "integer literal `" + digits + "` (out of 64-bit range)";
        }
    }

    record UnexpectedChar(int codePoint) implements RawToken {
        @Override
        public String describe() {
            return "invalid token `" + Character.toString(codePoint) + "`";
        }
    }
}

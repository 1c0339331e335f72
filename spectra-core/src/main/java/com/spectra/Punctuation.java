package com.spectra;

import java.util.Optional;

public enum Punctuation implements RawToken {
    PLUS("+"),
    PLUS_PLUS("++"),
    PLUS_EQ("+="),
    MINUS("-"),
    MINUS_MINUS("--"),
    MINUS_EQ("-="),
    STAR("*"),
    STAR_STAR("**"),
    STAR_EQ("*="),
    SLASH("/"),
    SLASH_EQ("/="),
    EQ("="),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    SEMICOLON(";"),
    COMMA(","),
    DOT(".");

    private final String symbol;

    Punctuation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<Punctuation> fromSymbol(String text) {
        for (Punctuation punctuation : values()) {
            if (punctuation.symbol.equals(text)) {
                return Optional.of(punctuation);
            }
        }
        return Optional.empty();
    }

    /**
     * Binding strength of this punctuation when it follows an operand.
     */
    public Precedence precedence() {
        return switch (this) {
            case EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ, PLUS_PLUS, MINUS_MINUS -> Precedence.ASSIGN;
            case PLUS, MINUS -> Precedence.SUM;
            case STAR, SLASH -> Precedence.PRODUCT;
            case STAR_STAR -> Precedence.POWER;
            case OPEN_PAREN -> Precedence.CALL;
            case DOT -> Precedence.FIELD_ACCESS;
            case OPEN_BRACKET, CLOSE_BRACKET, OPEN_BRACE, CLOSE_BRACE, CLOSE_PAREN, SEMICOLON, COMMA -> Precedence.LOWEST;
        };
    }

    @Override
    public String describe() {
        return "`" + symbol + "`";
    }
}

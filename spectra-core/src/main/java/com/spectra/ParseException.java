package com.spectra;

import java.util.Optional;

/**
 * Thrown by the {@link Parser} at the first token that does not fit the grammar.
 * There is no recovery: the whole parse is abandoned.
 */
public class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseException(String expected, Token got) {
        this(ParseError.unexpected(expected, got));
    }

    public ParseError error() {
        return error;
    }

    public String expected() {
        return error.expected();
    }

    public Optional<Token> got() {
        return error.got();
    }

    /**
     * Location of the offending token, or null when the input ended early.
     */
    public Location location() {
        return error.got().map(Token::location).orElse(null);
    }
}

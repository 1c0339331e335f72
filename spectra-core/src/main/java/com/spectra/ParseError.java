package com.spectra;

import java.util.Optional;

/**
 * What the parser wanted and what it found instead. An empty {@code got} means the
 * input ended where a token was required.
 */
public record ParseError(String expected, Optional<Token> got) {

    public static ParseError unexpected(String expected, Token got) {
        return new ParseError(expected, Optional.ofNullable(got));
    }

    public String message() {
        return "expected " + expected + ", got " + got.map(Token::describe).orElse("end of input");
    }
}

package com.spectra;

import java.util.Optional;

public enum Keyword implements RawToken {
    FUN("fun"),
    CLASS("class"),
    WHILE("while"),
    IF("if"),
    ELSE("else"),
    VAR("var"),
    BREAK("break"),
    CONTINUE("continue"),
    RETURN("return");

    private final String spelling;

    Keyword(String spelling) {
        this.spelling = spelling;
    }

    public String spelling() {
        return spelling;
    }

    public static Optional<Keyword> fromSpelling(String text) {
        for (Keyword keyword : values()) {
            if (keyword.spelling.equals(text)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "`" + spelling + "`";
    }
}

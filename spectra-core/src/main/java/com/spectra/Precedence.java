package com.spectra;

/**
 * Operator binding strength, lowest first. The declaration order is the ordering
 * the expression parser compares against.
 */
public enum Precedence {
    LOWEST,
    ASSIGN,
    SUM,
    PRODUCT,
    POWER,
    CALL,
    FIELD_ACCESS;

    public static Precedence of(RawToken raw) {
        if (raw instanceof Punctuation punctuation) {
            return punctuation.precedence();
        }
        return LOWEST;
    }

    public boolean isLowerThan(Precedence other) {
        return compareTo(other) < 0;
    }
}

package com.spectra;

/**
 * A lexical unit together with the source range it was scanned from.
 */
public record Token(RawToken raw, Location location) {

    public Precedence precedence() {
        return Precedence.of(raw);
    }

    public boolean is(RawToken expected) {
        return raw.equals(expected);
    }

    public String describe() {
        return raw.describe();
    }
}

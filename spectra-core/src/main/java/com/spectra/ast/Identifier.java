package com.spectra.ast;

import com.spectra.Location;

public record Identifier(
    Location location,
    String name
) implements Expression {
    @Override
    public String type() {
        return "Identifier";
    }
}

package com.spectra.ast;

import com.spectra.Location;

public record VarStatement(
    Location location,
    Identifier name,
    Expression initializer
) implements Statement {
    @Override
    public String type() {
        return "VarStatement";
    }
}

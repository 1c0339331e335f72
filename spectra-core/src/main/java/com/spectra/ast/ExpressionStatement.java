package com.spectra.ast;

import com.spectra.Location;

public record ExpressionStatement(
    Location location,
    Expression expression
) implements Statement {
    @Override
    public String type() {
        return "ExpressionStatement";
    }
}

package com.spectra.ast;

import com.spectra.Location;

public record FieldAccessExpression(
    Location location,
    Expression left,
    Identifier field
) implements Expression {
    @Override
    public String type() {
        return "FieldAccessExpression";
    }
}

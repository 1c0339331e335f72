package com.spectra.ast;

import com.spectra.Location;

public record ReturnStatement(
    Location location,
    Expression value
) implements Statement {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}

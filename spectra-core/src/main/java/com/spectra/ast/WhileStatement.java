package com.spectra.ast;

import com.spectra.Location;

public record WhileStatement(
    Location location,
    Expression condition,
    StatementsBlock body
) implements Statement {
    @Override
    public String type() {
        return "WhileStatement";
    }
}

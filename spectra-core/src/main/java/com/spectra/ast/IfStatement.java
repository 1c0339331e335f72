package com.spectra.ast;

import com.spectra.Location;

public record IfStatement(
    Location location,
    Expression condition,
    StatementsBlock consequent,
    Statement alternate  // null without `else`; otherwise an IfStatement or a BlockStatement
) implements Statement {
    @Override
    public String type() {
        return "IfStatement";
    }
}

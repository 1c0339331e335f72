package com.spectra.ast;

import com.spectra.Location;

import java.util.List;

/**
 * {@code fun (a, b) { ... }}
 */
public record FunctionExpression(
    Location location,
    List<Identifier> parameters,
    StatementsBlock body
) implements Expression {

    public FunctionExpression {
        parameters = List.copyOf(parameters);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}

package com.spectra.ast;

import com.spectra.Location;

import java.util.List;

public record CallExpression(
    Location location,
    Expression callee,
    List<Expression> arguments
) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}

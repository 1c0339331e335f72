package com.spectra.ast;

import com.spectra.Location;
import com.spectra.Token;

public record BinaryExpression(
    Location location,
    Expression left,
    Expression right,
    Token operator  // + - * / ** or an assignment operator
) implements Expression {
    @Override
    public String type() {
        return "BinaryExpression";
    }
}

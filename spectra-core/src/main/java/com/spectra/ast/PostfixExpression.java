package com.spectra.ast;

import com.spectra.Location;
import com.spectra.Token;

public record PostfixExpression(
    Location location,
    Expression left,
    Token operator  // ++ | --
) implements Expression {
    @Override
    public String type() {
        return "PostfixExpression";
    }
}

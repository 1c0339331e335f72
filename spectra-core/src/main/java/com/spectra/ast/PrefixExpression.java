package com.spectra.ast;

import com.spectra.Location;
import com.spectra.Token;

public record PrefixExpression(
    Location location,
    Token operator,  // + | - | ++ | --
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "PrefixExpression";
    }
}

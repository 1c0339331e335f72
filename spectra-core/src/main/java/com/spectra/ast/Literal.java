package com.spectra.ast;

import com.spectra.Location;

public record Literal(
    Location location,
    RawLiteral raw
) implements Expression {
    @Override
    public String type() {
        return "Literal";
    }
}

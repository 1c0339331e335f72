package com.spectra.ast;

import com.spectra.Location;

import java.util.List;

public record StatementsBlock(
    Location location,  // from `{` through `}`
    List<Statement> statements
) implements Node {

    public StatementsBlock {
        statements = List.copyOf(statements);
    }

    @Override
    public String type() {
        return "StatementsBlock";
    }
}

package com.spectra.ast;

import com.spectra.Location;

/**
 * A braced block used in statement position.
 */
public record BlockStatement(StatementsBlock block) implements Statement {
    @Override
    public Location location() {
        return block.location();
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}

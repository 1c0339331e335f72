package com.spectra.ast;

import com.spectra.Location;

public record BreakStatement(Location location) implements Statement {
    @Override
    public String type() {
        return "BreakStatement";
    }
}

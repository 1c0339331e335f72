package com.spectra.ast;

import com.spectra.Location;

public record ContinueStatement(Location location) implements Statement {
    @Override
    public String type() {
        return "ContinueStatement";
    }
}

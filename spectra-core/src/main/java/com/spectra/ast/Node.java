package com.spectra.ast;

import com.spectra.Location;

/**
 * Base interface for all AST nodes
 */
public sealed interface Node permits
    Module,
    StatementsBlock,
    Statement,
    Expression {

    String type();
    Location location();
}

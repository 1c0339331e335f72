package com.spectra.json;

import com.spectra.ast.Node;

/**
 * Writes AST nodes as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node, and everything below it, to compact JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with indentation and line breaks.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}

package com.spectra.json;

import com.spectra.ast.Module;
import com.spectra.ast.Node;

/**
 * Reads AST nodes back from the JSON an {@link AstJsonSerializer} wrote.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a whole module (the root node).
     *
     * @param json the JSON text
     * @return the module, equal to the one that was serialized
     * @throws AstJsonException if the JSON is malformed or does not describe a module
     */
    Module deserializeModule(String json) throws AstJsonException;

    /**
     * Deserializes a node of a specific type.
     *
     * @param json the JSON text
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if the JSON is malformed or describes another node type
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}

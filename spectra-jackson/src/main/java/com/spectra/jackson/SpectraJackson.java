package com.spectra.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for the Spectra AST.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SpectraJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(module);
 * Module module = mapper.readValue(json, Module.class);
 * </pre>
 */
public final class SpectraJackson {

    private SpectraJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Writes a "type" discriminator on every node
     * - Writes locations as {"start", "end"} byte offsets
     * - Writes tokens and literal payloads as {"kind", "value"} objects, integers unsigned
     * - Omits null values except where the AST shape needs them (IfStatement.alternate)
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}

package com.spectra.jackson;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectra.ast.Module;
import com.spectra.ast.Node;
import com.spectra.json.AstJsonDeserializer;
import com.spectra.json.AstJsonException;
import com.spectra.json.AstJsonProvider;
import com.spectra.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(SpectraJackson.createObjectMapper());
    }

    JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw failure(node, e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw failure(node, e);
            }
        }

        private static AstJsonException failure(Node node, Exception e) {
            return new AstJsonException("Failed to serialize " + node.type() + " at " + node.location(),
                node.location(), e);
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Module deserializeModule(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Module.class);
            } catch (Exception e) {
                throw failure("Module", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw failure(type.getSimpleName(), e);
            }
        }

        // Points at the position in the JSON text where Jackson gave up, when it knows it
        private static AstJsonException failure(String typeName, Exception e) {
            if (e instanceof JsonProcessingException processing && processing.getLocation() != null) {
                JsonLocation at = processing.getLocation();
                return new AstJsonException("Failed to deserialize " + typeName
                    + " at line " + at.getLineNr() + ", column " + at.getColumnNr()
                    + ": " + processing.getOriginalMessage(), e);
            }
            return new AstJsonException("Failed to deserialize " + typeName, e);
        }
    }
}

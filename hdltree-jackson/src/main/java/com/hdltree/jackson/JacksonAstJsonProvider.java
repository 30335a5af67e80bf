package com.hdltree.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hdltree.ast.DesignFile;
import com.hdltree.ast.Node;
import com.hdltree.extract.ExtractionResult;
import com.hdltree.json.AstJsonDeserializer;
import com.hdltree.json.AstJsonException;
import com.hdltree.json.AstJsonProvider;
import com.hdltree.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = HdlTreeJackson.createObjectMapper();
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
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serialize(ExtractionResult result) throws AstJsonException {
            try {
                return mapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize declarations", e);
            }
        }

        @Override
        public String serializePretty(ExtractionResult result) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize declarations", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public DesignFile deserializeDesignFile(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, DesignFile.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize DesignFile", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }

        @Override
        public ExtractionResult deserializeDeclarations(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, ExtractionResult.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize declarations", e);
            }
        }
    }
}

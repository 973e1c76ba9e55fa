package com.cstkit.jackson;

import com.cstkit.codegen.CodeRange;
import com.cstkit.json.CstJsonDeserializer;
import com.cstkit.json.CstJsonException;
import com.cstkit.json.CstJsonProvider;
import com.cstkit.json.CstJsonSerializer;
import com.cstkit.nodes.CstNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson-based implementation of CstJsonProvider.
 */
public class JacksonCstJsonProvider implements CstJsonProvider {

    private static final Logger log = LoggerFactory.getLogger(JacksonCstJsonProvider.class);

    private final ObjectMapper mapper;
    private final CstJsonSerializer serializer;
    private final CstJsonDeserializer deserializer;

    public JacksonCstJsonProvider() {
        this(CstJackson.createObjectMapper());
    }

    public JacksonCstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public CstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public CstJsonDeserializer getDeserializer() {
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

    private static class JacksonSerializer implements CstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(CstNode node) throws CstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw failure(node, e);
            }
        }

        @Override
        public String serializePretty(CstNode node) throws CstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw failure(node, e);
            }
        }

        private static CstJsonException failure(CstNode node, Exception cause) {
            String type = node == null ? null : node.type();
            return new CstJsonException("Failed to serialize " + (type == null ? "null node" : type), type, cause);
        }
    }

    private static class JacksonDeserializer implements CstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public CodeRange deserializeRange(String json) throws CstJsonException {
            try {
                return mapper.readValue(json, CodeRange.class);
            } catch (Exception e) {
                throw new CstJsonException("Failed to deserialize CodeRange", e);
            }
        }

        @Override
        public Map<String, CodeRange> deserializePositions(String json) throws CstJsonException {
            JsonNode positions;
            try {
                positions = mapper.readTree(json).path("positions");
            } catch (Exception e) {
                throw new CstJsonException("Failed to read node JSON", e);
            }
            if (positions.isMissingNode()) {
                log.debug("Node JSON carries no positions");
                return Collections.emptyMap();
            }
            if (!positions.isObject()) {
                throw new CstJsonException("Expected 'positions' to be an object, got " + positions.getNodeType());
            }

            Map<String, CodeRange> result = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = positions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                try {
                    result.put(field.getKey(), mapper.treeToValue(field.getValue(), CodeRange.class));
                } catch (Exception e) {
                    throw new CstJsonException("Failed to deserialize range for provider '" + field.getKey() + "'", e);
                }
            }
            return Collections.unmodifiableMap(result);
        }
    }
}

package com.cstkit.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax
 * tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CstJackson.createObjectMapper();
 * module.resolvePositions(PositionProvider.SYNTACTIC);
 * String json = mapper.writeValueAsString(module);
 * </pre>
 */
public final class CstJackson {

    private CstJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization.
     *
     * The returned mapper:
     * - Writes every node with a "type" property holding its node kind
     * - Writes recorded ranges under "positions" instead of the raw metadata
     * - Writes defaulted slots as "DEFAULT"
     * - Omits absent optional fields, except an If's orelse
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Exclude null values by default; If.orelse is kept via a mixin in CstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Leaf-only nodes such as Pass must still serialize
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // Ignore unknown properties when reading ranges back
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new CstModule());

        return mapper;
    }
}

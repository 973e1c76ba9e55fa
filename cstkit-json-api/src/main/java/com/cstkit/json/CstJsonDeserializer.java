package com.cstkit.json;

import com.cstkit.codegen.CodeRange;

import java.util.Map;

/**
 * Interface for reading position data back from JSON written by a
 * {@link CstJsonSerializer}.
 */
public interface CstJsonDeserializer {

    /**
     * Reads a single range, {@code {"start":{"line":..,"column":..},"end":{..}}}.
     *
     * @param json the JSON string to read
     * @return the range
     * @throws CstJsonException if the JSON is malformed or describes an invalid range
     */
    CodeRange deserializeRange(String json) throws CstJsonException;

    /**
     * Reads the {@code "positions"} object of a serialized node.
     *
     * @param json a serialized node
     * @return ranges keyed by provider name, in document order; empty if the
     *         node carries none
     * @throws CstJsonException if the JSON is malformed
     */
    Map<String, CodeRange> deserializePositions(String json) throws CstJsonException;
}

package com.cstkit.json;

import com.cstkit.nodes.CstNode;

/**
 * Interface for writing syntax tree nodes as JSON.
 *
 * <p>Every node becomes an object with a {@code "type"} property, its
 * structural fields, and a {@code "positions"} object holding the ranges that
 * have been recorded for it so far, keyed by provider name.</p>
 */
public interface CstJsonSerializer {

    /**
     * Serializes a node and its subtree to a JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws CstJsonException if serialization fails
     */
    String serialize(CstNode node) throws CstJsonException;

    /**
     * Serializes a node and its subtree to a pretty-printed JSON string.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws CstJsonException if serialization fails
     */
    String serializePretty(CstNode node) throws CstJsonException;
}

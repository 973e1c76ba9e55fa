package com.cstkit.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ranges recorded for a single node instance, keyed by the provider that
 * recorded them. Owned by the node and populated while it is rendered.
 */
public final class NodeMetadata {

    private final Map<PositionProvider, CodeRange> ranges = new LinkedHashMap<>();

    /**
     * Stores {@code range} unless the provider already has one for this node.
     *
     * @return true if the range was stored
     */
    public boolean recordIfAbsent(PositionProvider provider, CodeRange range) {
        return ranges.putIfAbsent(provider, range) == null;
    }

    /**
     * Stores {@code range}, replacing any earlier range from the same provider.
     */
    public void record(PositionProvider provider, CodeRange range) {
        ranges.put(provider, range);
    }

    public Optional<CodeRange> get(PositionProvider provider) {
        return Optional.ofNullable(ranges.get(provider));
    }

    public boolean contains(PositionProvider provider) {
        return ranges.containsKey(provider);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Read-only view in recording order.
     */
    public Map<PositionProvider, CodeRange> asMap() {
        return Collections.unmodifiableMap(ranges);
    }

    @Override
    public String toString() {
        return ranges.toString();
    }
}

package com.cstkit.nodes;

import java.util.Objects;

/**
 * A child slot that either holds a node or asks codegen to render its default.
 *
 * <p>Distinct from an absent optional field ({@code null}): a defaulted slot
 * still takes part in rendering, the owning node decides what its default
 * looks like.</p>
 */
public sealed interface MaybeSentinel<T extends CstNode> permits MaybeSentinel.Default, MaybeSentinel.Value {

    Default<?> DEFAULT = new Default<>();

    @SuppressWarnings("unchecked")
    static <T extends CstNode> MaybeSentinel<T> useDefault() {
        return (MaybeSentinel<T>) DEFAULT;
    }

    static <T extends CstNode> MaybeSentinel<T> of(T node) {
        return new Value<>(node);
    }

    default boolean isDefault() {
        return this instanceof Default;
    }

    /**
     * The held node, or {@code null} for the default.
     */
    default T orNull() {
        return this instanceof Value<T> value ? value.node() : null;
    }

    record Default<T extends CstNode>() implements MaybeSentinel<T> {
        @Override
        public String toString() {
            return "MaybeSentinel.DEFAULT";
        }
    }

    record Value<T extends CstNode>(T node) implements MaybeSentinel<T> {
        public Value {
            Objects.requireNonNull(node, "node; use MaybeSentinel.useDefault() instead");
        }
    }
}

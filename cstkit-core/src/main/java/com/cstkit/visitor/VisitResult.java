package com.cstkit.visitor;

import com.cstkit.nodes.CstNode;

import java.util.Objects;

/**
 * What a visitor decided for the node it just left.
 */
public sealed interface VisitResult permits VisitResult.Unchanged, VisitResult.Replaced, VisitResult.Removed {

    static VisitResult unchanged() {
        return Unchanged.INSTANCE;
    }

    static VisitResult replaced(CstNode node) {
        return new Replaced(node);
    }

    static VisitResult removed() {
        return Removed.INSTANCE;
    }

    /**
     * {@link #unchanged()} when {@code updated} is the very same instance as
     * {@code original}, otherwise {@link #replaced(CstNode)}.
     */
    static VisitResult of(CstNode original, CstNode updated) {
        return original == updated ? unchanged() : replaced(updated);
    }

    /**
     * The node that should occupy the slot, or {@code null} for a removal.
     */
    default CstNode resolve(CstNode original) {
        if (this instanceof Replaced replaced) {
            return replaced.node();
        }
        if (this instanceof Removed) {
            return null;
        }
        return original;
    }

    record Unchanged() implements VisitResult {
        static final Unchanged INSTANCE = new Unchanged();
    }

    record Replaced(CstNode node) implements VisitResult {
        public Replaced {
            Objects.requireNonNull(node, "replacement node; use VisitResult.removed() to delete");
        }
    }

    record Removed() implements VisitResult {
        static final Removed INSTANCE = new Removed();
    }
}

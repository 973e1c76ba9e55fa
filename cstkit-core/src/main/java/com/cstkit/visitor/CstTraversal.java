package com.cstkit.visitor;

import com.cstkit.codegen.CstUsageException;
import com.cstkit.nodes.CstNode;
import com.cstkit.nodes.MaybeSentinel;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Applies a visitor to one child slot of a node and reconciles the result with
 * what the slot allows. Nodes call one of these per field, in source order,
 * when rebuilding themselves.
 *
 * <p>The field name is only used for error messages.</p>
 */
public final class CstTraversal {

    private CstTraversal() {
        // Utility class
    }

    /**
     * Visits a slot that must always hold a node.
     *
     * @throws CstUsageException if the visitor asks to remove the node
     */
    public static <T extends CstNode> T visitRequired(String fieldName, T node, CstVisitor visitor) {
        Objects.requireNonNull(node, fieldName);
        VisitResult result = node.visit(visitor);
        if (result instanceof VisitResult.Removed) {
            throw new CstUsageException(
                "Removal was requested while visiting a " + node.type() + " in field '" + fieldName
                    + "', but its parent does not allow it to be removed.");
        }
        return narrow(result.resolve(node));
    }

    /**
     * Visits a slot that may not exist ({@code null}). The visitor is not called
     * for an absent node; a removal makes the slot absent.
     */
    public static <T extends CstNode> T visitOptional(String fieldName, T node, CstVisitor visitor) {
        if (node == null) {
            return null;
        }
        return narrow(node.visit(visitor).resolve(node));
    }

    /**
     * Visits a slot that renders a default when it holds no node. The visitor
     * is not called for {@link MaybeSentinel#DEFAULT}; a removal turns the slot
     * back into the default.
     */
    public static <T extends CstNode> MaybeSentinel<T> visitSentinel(
            String fieldName, MaybeSentinel<T> slot, CstVisitor visitor) {
        Objects.requireNonNull(slot, fieldName);
        if (!(slot instanceof MaybeSentinel.Value<T> value)) {
            return MaybeSentinel.useDefault();
        }
        T node = value.node();
        CstNode result = node.visit(visitor).resolve(node);
        if (result == null) {
            return MaybeSentinel.useDefault();
        }
        return result == node ? slot : MaybeSentinel.of(narrow(result));
    }

    /**
     * Visits every node of a collection slot lazily. Removed entries are
     * dropped and the rest keep their relative order. The stream can only be
     * consumed once.
     */
    public static <T extends CstNode> Stream<T> visitIterable(
            String fieldName, Iterable<? extends T> children, CstVisitor visitor) {
        Objects.requireNonNull(children, fieldName);
        return StreamSupport.stream(children.spliterator(), false)
            .map(child -> CstTraversal.<T>narrow(child.visit(visitor).resolve(child)))
            .filter(Objects::nonNull);
    }

    /**
     * Like {@link #visitIterable(String, Iterable, CstVisitor)} but collects
     * into an unmodifiable list.
     */
    public static <T extends CstNode> List<T> visitSequence(
            String fieldName, Iterable<? extends T> children, CstVisitor visitor) {
        return CstTraversal.<T>visitIterable(fieldName, children, visitor).toList();
    }

    // A replacement of the wrong type surfaces as a ClassCastException where the
    // parent stores the field.
    @SuppressWarnings("unchecked")
    private static <T extends CstNode> T narrow(CstNode node) {
        return (T) node;
    }
}

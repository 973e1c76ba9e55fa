package com.cstkit.visitor;

import com.cstkit.nodes.CstNode;

/**
 * Generic hooks called while a tree is walked by {@link CstNode#visit(CstVisitor)}.
 *
 * <p>Read-only visitors only override {@link #onVisit(CstNode)}. Transformers
 * override {@link #onLeave(CstNode, CstNode)} and return a replacement or a
 * removal request; the parent's slot decides whether removal is allowed.</p>
 */
public interface CstVisitor {

    /**
     * Called before the children of {@code node} are visited.
     *
     * @return false to skip the children
     */
    default boolean onVisit(CstNode node) {
        return true;
    }

    /**
     * Called after the children were visited.
     *
     * @param originalNode the node as it was before the walk
     * @param updatedNode  the node rebuilt with visited children, or
     *                     {@code originalNode} when no child changed
     */
    default VisitResult onLeave(CstNode originalNode, CstNode updatedNode) {
        return VisitResult.of(originalNode, updatedNode);
    }
}

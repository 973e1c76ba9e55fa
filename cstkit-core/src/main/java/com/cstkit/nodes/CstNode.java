package com.cstkit.nodes;

import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.codegen.NodeMetadata;
import com.cstkit.codegen.PositionProvider;
import com.cstkit.visitor.CstVisitor;
import com.cstkit.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Base class for every concrete syntax tree node.
 *
 * <p>Nodes are immutable apart from their {@link NodeMetadata}, which rendering
 * fills in. The same instance may appear under several parents or in several
 * trees.</p>
 */
public abstract class CstNode {

    private final NodeMetadata metadata = new NodeMetadata();

    /**
     * Node kind, the simple class name.
     */
    public String type() {
        return getClass().getSimpleName();
    }

    /**
     * Direct children in source order. Absent and defaulted slots are skipped.
     */
    public abstract List<CstNode> children();

    /**
     * Returns a copy of this node whose child slots were visited with
     * {@code visitor} through {@link com.cstkit.visitor.CstTraversal}.
     */
    protected abstract CstNode visitChildren(CstVisitor visitor);

    /**
     * Emits this node's own tokens and renders its children.
     */
    protected abstract void codegenImpl(CodegenState state);

    public final VisitResult visit(CstVisitor visitor) {
        CstNode updated = this;
        if (visitor.onVisit(this)) {
            CstNode rebuilt = visitChildren(visitor);
            if (!sameChildren(rebuilt)) {
                updated = rebuilt;
            }
        }
        return visitor.onLeave(this, updated);
    }

    public final void codegen(CodegenState state) {
        try (CodegenState.PositionScope ignored = state.recordSyntacticPosition(this)) {
            codegenImpl(state);
        }
    }

    public NodeMetadata metadata() {
        return metadata;
    }

    public Optional<CodeRange> position(PositionProvider provider) {
        return metadata.get(provider);
    }

    private boolean sameChildren(CstNode rebuilt) {
        if (rebuilt == this) {
            return true;
        }
        List<CstNode> before = children();
        List<CstNode> after = rebuilt.children();
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i < before.size(); i++) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return type() + children();
    }
}

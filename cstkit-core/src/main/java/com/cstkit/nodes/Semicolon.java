package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A {@code ;} separating small statements, with the whitespace around it.
 */
public final class Semicolon extends CstNode {

    private final SimpleWhitespace whitespaceBefore;
    private final SimpleWhitespace whitespaceAfter;

    public Semicolon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) {
        this.whitespaceBefore = Objects.requireNonNull(whitespaceBefore, "whitespaceBefore");
        this.whitespaceAfter = Objects.requireNonNull(whitespaceAfter, "whitespaceAfter");
    }

    public SimpleWhitespace whitespaceBefore() {
        return whitespaceBefore;
    }

    public SimpleWhitespace whitespaceAfter() {
        return whitespaceAfter;
    }

    @Override
    public List<CstNode> children() {
        return Children.of(whitespaceBefore, whitespaceAfter);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new Semicolon(
            CstTraversal.visitRequired("whitespaceBefore", whitespaceBefore, visitor),
            CstTraversal.visitRequired("whitespaceAfter", whitespaceAfter, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.addToken(";");
        whitespaceAfter.codegen(state);
    }
}

package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A {@code #} comment running to the end of the line.
 */
public final class Comment extends CstNode {

    private final String value;

    public Comment(String value) {
        this.value = Objects.requireNonNull(value, "value");
        if (!value.startsWith("#")) {
            throw new IllegalArgumentException("Comment must start with '#': " + value);
        }
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Comment cannot span lines");
        }
    }

    public String value() {
        return value;
    }

    @Override
    public List<CstNode> children() {
        return List.of();
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return this;
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        state.addToken(value);
    }

    @Override
    public String toString() {
        return "Comment[" + value + "]";
    }
}

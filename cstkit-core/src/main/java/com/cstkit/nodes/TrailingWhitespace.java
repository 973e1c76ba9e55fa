package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Whatever ends a line that holds code: whitespace, an optional comment and
 * the newline.
 */
public final class TrailingWhitespace extends CstNode {

    private final SimpleWhitespace whitespace;
    private final Comment comment; // Can be null
    private final Newline newline;

    public TrailingWhitespace(SimpleWhitespace whitespace, Comment comment, Newline newline) {
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace");
        this.comment = comment;
        this.newline = Objects.requireNonNull(newline, "newline");
    }

    /**
     * Just the module's default newline.
     */
    public static TrailingWhitespace endOfLine() {
        return new TrailingWhitespace(SimpleWhitespace.empty(), null, Newline.useDefault());
    }

    public SimpleWhitespace whitespace() {
        return whitespace;
    }

    public Comment comment() {
        return comment;
    }

    public Newline newline() {
        return newline;
    }

    @Override
    public List<CstNode> children() {
        return Children.of(whitespace, comment, newline);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new TrailingWhitespace(
            CstTraversal.visitRequired("whitespace", whitespace, visitor),
            CstTraversal.visitOptional("comment", comment, visitor),
            CstTraversal.visitRequired("newline", newline, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        whitespace.codegen(state);
        if (comment != null) {
            comment.codegen(state);
        }
        newline.codegen(state);
    }
}

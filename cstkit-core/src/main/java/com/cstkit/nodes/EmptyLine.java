package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A line without code: blank, or holding only a comment.
 *
 * <p>When {@code indent} is true the line starts with the indentation in
 * effect where it is rendered, followed by {@code whitespace}. Otherwise
 * {@code whitespace} is the whole prefix.</p>
 */
public final class EmptyLine extends CstNode {

    private final boolean indent;
    private final SimpleWhitespace whitespace;
    private final Comment comment; // Can be null
    private final Newline newline;

    public EmptyLine(boolean indent, SimpleWhitespace whitespace, Comment comment, Newline newline) {
        this.indent = indent;
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace");
        this.comment = comment;
        this.newline = Objects.requireNonNull(newline, "newline");
    }

    public static EmptyLine blank() {
        return new EmptyLine(true, SimpleWhitespace.empty(), null, Newline.useDefault());
    }

    public static EmptyLine comment(String text) {
        return new EmptyLine(true, SimpleWhitespace.empty(), new Comment(text), Newline.useDefault());
    }

    public boolean indent() {
        return indent;
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
        return new EmptyLine(
            indent,
            CstTraversal.visitRequired("whitespace", whitespace, visitor),
            CstTraversal.visitOptional("comment", comment, visitor),
            CstTraversal.visitRequired("newline", newline, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        if (indent) {
            state.addIndentTokens();
        }
        whitespace.codegen(state);
        if (comment != null) {
            comment.codegen(state);
        }
        newline.codegen(state);
    }
}

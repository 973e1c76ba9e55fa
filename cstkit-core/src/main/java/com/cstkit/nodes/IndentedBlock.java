package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * The body of a compound statement: the rest of the header line, then
 * statements indented one level deeper.
 *
 * <p>{@code indent} is the indentation this block adds relative to its parent;
 * {@code null} uses the module's default indent. {@code footer} holds comment
 * lines at the end of the block that are indented with it.</p>
 */
public final class IndentedBlock extends CstNode {

    private final TrailingWhitespace header;
    private final String indent; // Can be null
    private final List<BaseStatement> body;
    private final List<EmptyLine> footer;

    public IndentedBlock(TrailingWhitespace header, String indent, List<? extends BaseStatement> body,
                         List<EmptyLine> footer) {
        this.header = Objects.requireNonNull(header, "header");
        this.indent = indent;
        this.body = List.copyOf(body);
        this.footer = List.copyOf(footer);
    }

    public IndentedBlock(List<? extends BaseStatement> body) {
        this(TrailingWhitespace.endOfLine(), null, body, List.of());
    }

    public TrailingWhitespace header() {
        return header;
    }

    public String indent() {
        return indent;
    }

    public List<BaseStatement> body() {
        return body;
    }

    public List<EmptyLine> footer() {
        return footer;
    }

    public IndentedBlock withBody(List<? extends BaseStatement> body) {
        return new IndentedBlock(header, indent, body, footer);
    }

    @Override
    public List<CstNode> children() {
        return Children.of(header, body, footer);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new IndentedBlock(
            CstTraversal.visitRequired("header", header, visitor),
            indent,
            CstTraversal.visitSequence("body", body, visitor),
            CstTraversal.visitSequence("footer", footer, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        header.codegen(state);

        try (CodegenState.IndentScope ignored = state.indent(indent == null ? state.defaultIndent() : indent)) {
            if (body.isEmpty()) {
                // An empty block is not valid source, so it gets a pass line
                state.addIndentTokens();
                state.addToken("pass");
                state.addToken(state.defaultNewline());
            } else {
                for (BaseStatement stmt : body) {
                    stmt.codegen(state);
                }
            }
            for (EmptyLine line : footer) {
                line.codegen(state);
            }
        }
    }
}

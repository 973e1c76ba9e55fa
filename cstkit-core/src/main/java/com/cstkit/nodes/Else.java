package com.cstkit.nodes;

import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * The {@code else:} clause of an {@link If}.
 */
public final class Else extends CstNode {

    private final List<EmptyLine> leadingLines;
    private final SimpleWhitespace whitespaceBeforeColon;
    private final IndentedBlock body;

    public Else(List<EmptyLine> leadingLines, SimpleWhitespace whitespaceBeforeColon, IndentedBlock body) {
        this.leadingLines = List.copyOf(leadingLines);
        this.whitespaceBeforeColon = Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon");
        this.body = Objects.requireNonNull(body, "body");
    }

    public Else(IndentedBlock body) {
        this(List.of(), SimpleWhitespace.empty(), body);
    }

    public List<EmptyLine> leadingLines() {
        return leadingLines;
    }

    public SimpleWhitespace whitespaceBeforeColon() {
        return whitespaceBeforeColon;
    }

    public IndentedBlock body() {
        return body;
    }

    @Override
    public List<CstNode> children() {
        return Children.of(leadingLines, whitespaceBeforeColon, body);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new Else(
            CstTraversal.visitSequence("leadingLines", leadingLines, visitor),
            CstTraversal.visitRequired("whitespaceBeforeColon", whitespaceBeforeColon, visitor),
            CstTraversal.visitRequired("body", body, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        for (EmptyLine line : leadingLines) {
            line.codegen(state);
        }
        state.addIndentTokens();

        CodePosition start = state.position();
        state.addToken("else");
        whitespaceBeforeColon.codegen(state);
        state.addToken(":");
        CodePosition end = state.position();

        body.codegen(state);
        state.recordPosition(this, new CodeRange(start, end));
    }
}

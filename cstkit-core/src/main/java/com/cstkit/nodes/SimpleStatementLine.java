package com.cstkit.nodes;

import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * One line of small statements, for example {@code a; b  # note}.
 */
public final class SimpleStatementLine extends BaseStatement {

    private final List<BaseSmallStatement> body;
    private final TrailingWhitespace trailingWhitespace;

    public SimpleStatementLine(List<EmptyLine> leadingLines, List<? extends BaseSmallStatement> body,
                               TrailingWhitespace trailingWhitespace) {
        super(leadingLines);
        this.body = List.copyOf(body);
        this.trailingWhitespace = Objects.requireNonNull(trailingWhitespace, "trailingWhitespace");
    }

    public SimpleStatementLine(List<? extends BaseSmallStatement> body) {
        this(List.of(), body, TrailingWhitespace.endOfLine());
    }

    public List<BaseSmallStatement> body() {
        return body;
    }

    public TrailingWhitespace trailingWhitespace() {
        return trailingWhitespace;
    }

    public SimpleStatementLine withBody(List<? extends BaseSmallStatement> body) {
        return new SimpleStatementLine(leadingLines(), body, trailingWhitespace);
    }

    @Override
    public List<CstNode> children() {
        return Children.of(leadingLines(), body, trailingWhitespace);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new SimpleStatementLine(
            CstTraversal.visitSequence("leadingLines", leadingLines(), visitor),
            CstTraversal.visitSequence("body", body, visitor),
            CstTraversal.visitRequired("trailingWhitespace", trailingWhitespace, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        for (EmptyLine line : leadingLines()) {
            line.codegen(state);
        }
        state.addIndentTokens();

        CodePosition start = state.position();
        if (body.isEmpty()) {
            // A line needs at least one statement
            state.addToken("pass");
        } else {
            int last = body.size() - 1;
            for (int i = 0; i <= last; i++) {
                body.get(i).codegen(state, i < last);
            }
        }
        CodePosition end = state.position();

        trailingWhitespace.codegen(state);
        state.recordPosition(this, new CodeRange(start, end));
    }
}

package com.cstkit.nodes;

import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code if test:} followed by an indented block and an optional
 * {@code else:} clause.
 */
public final class If extends BaseStatement {

    private final SimpleWhitespace whitespaceBeforeTest;
    private final Name test;
    private final SimpleWhitespace whitespaceAfterTest;
    private final IndentedBlock body;
    private final Else orelse; // Can be null

    public If(List<EmptyLine> leadingLines, SimpleWhitespace whitespaceBeforeTest, Name test,
              SimpleWhitespace whitespaceAfterTest, IndentedBlock body, Else orelse) {
        super(leadingLines);
        this.whitespaceBeforeTest = Objects.requireNonNull(whitespaceBeforeTest, "whitespaceBeforeTest");
        this.test = Objects.requireNonNull(test, "test");
        this.whitespaceAfterTest = Objects.requireNonNull(whitespaceAfterTest, "whitespaceAfterTest");
        this.body = Objects.requireNonNull(body, "body");
        this.orelse = orelse;
    }

    public If(Name test, IndentedBlock body, Else orelse) {
        this(List.of(), new SimpleWhitespace(" "), test, SimpleWhitespace.empty(), body, orelse);
    }

    public SimpleWhitespace whitespaceBeforeTest() {
        return whitespaceBeforeTest;
    }

    public Name test() {
        return test;
    }

    public SimpleWhitespace whitespaceAfterTest() {
        return whitespaceAfterTest;
    }

    public IndentedBlock body() {
        return body;
    }

    public Else orelse() {
        return orelse;
    }

    public If withOrelse(Else orelse) {
        return new If(leadingLines(), whitespaceBeforeTest, test, whitespaceAfterTest, body, orelse);
    }

    @Override
    public List<CstNode> children() {
        return Children.of(leadingLines(), whitespaceBeforeTest, test, whitespaceAfterTest, body, orelse);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new If(
            CstTraversal.visitSequence("leadingLines", leadingLines(), visitor),
            CstTraversal.visitRequired("whitespaceBeforeTest", whitespaceBeforeTest, visitor),
            CstTraversal.visitRequired("test", test, visitor),
            CstTraversal.visitRequired("whitespaceAfterTest", whitespaceAfterTest, visitor),
            CstTraversal.visitRequired("body", body, visitor),
            CstTraversal.visitOptional("orelse", orelse, visitor));
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        for (EmptyLine line : leadingLines()) {
            line.codegen(state);
        }
        state.addIndentTokens();

        CodePosition start = state.position();
        state.addToken("if");
        whitespaceBeforeTest.codegen(state);
        test.codegen(state);
        whitespaceAfterTest.codegen(state);
        state.addToken(":");
        CodePosition end = state.position();

        body.codegen(state);
        state.recordPosition(this, new CodeRange(start, end));

        if (orelse != null) {
            orelse.codegen(state);
        }
    }
}

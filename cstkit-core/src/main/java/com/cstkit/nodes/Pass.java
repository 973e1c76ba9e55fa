package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;

public final class Pass extends BaseSmallStatement {

    public Pass() {
        this(MaybeSentinel.useDefault());
    }

    public Pass(MaybeSentinel<Semicolon> semicolon) {
        super(semicolon);
    }

    @Override
    public Pass withSemicolon(MaybeSentinel<Semicolon> semicolon) {
        return new Pass(semicolon);
    }

    @Override
    public List<CstNode> children() {
        return Children.of(semicolon());
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new Pass(CstTraversal.visitSentinel("semicolon", semicolon(), visitor));
    }

    @Override
    protected void codegenBody(CodegenState state) {
        state.addToken("pass");
    }
}

package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * An expression used as a statement.
 */
public final class Expr extends BaseSmallStatement {

    private final Name value;

    public Expr(Name value) {
        this(value, MaybeSentinel.useDefault());
    }

    public Expr(Name value, MaybeSentinel<Semicolon> semicolon) {
        super(semicolon);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Name value() {
        return value;
    }

    @Override
    public Expr withSemicolon(MaybeSentinel<Semicolon> semicolon) {
        return new Expr(value, semicolon);
    }

    @Override
    public List<CstNode> children() {
        return Children.of(value, semicolon());
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new Expr(
            CstTraversal.visitRequired("value", value, visitor),
            CstTraversal.visitSentinel("semicolon", semicolon(), visitor));
    }

    @Override
    protected void codegenBody(CodegenState state) {
        value.codegen(state);
    }
}

package com.cstkit.nodes;

import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An identifier.
 */
public final class Name extends CstNode {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String value;

    public Name(String value) {
        this.value = Objects.requireNonNull(value, "value");
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Not an identifier: '" + value + "'");
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
        CodePosition start = state.position();
        state.addToken(value);
        state.recordPosition(this, new CodeRange(start, state.position()));
    }

    @Override
    public String toString() {
        return "Name[" + value + "]";
    }
}

package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Spaces and tabs inside a line.
 */
public final class SimpleWhitespace extends CstNode {

    private final String value;

    public SimpleWhitespace(String value) {
        this.value = Objects.requireNonNull(value, "value");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != ' ' && c != '\t' && c != '\f') {
                throw new IllegalArgumentException("Not inline whitespace: " + value.replace("\n", "\\n"));
            }
        }
    }

    public static SimpleWhitespace empty() {
        return new SimpleWhitespace("");
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
        return "SimpleWhitespace[" + value + "]";
    }
}

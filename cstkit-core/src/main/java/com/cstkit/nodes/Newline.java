package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.visitor.CstVisitor;

import java.util.List;

/**
 * A line break. A {@code null} value renders the module's default newline;
 * anything else is kept verbatim so mixed line endings survive a round trip.
 */
public final class Newline extends CstNode {

    private final String value;

    public Newline(String value) {
        if (value != null && !value.equals("\n") && !value.equals("\r") && !value.equals("\r\n")) {
            throw new IllegalArgumentException("Not a newline sequence: " + value);
        }
        this.value = value;
    }

    public static Newline useDefault() {
        return new Newline(null);
    }

    /**
     * The literal sequence, or {@code null} for the default.
     */
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
        state.addToken(value == null ? state.defaultNewline() : value);
    }

    @Override
    public String toString() {
        return value == null ? "Newline[default]" : "Newline[" + value.replace("\r", "\\r").replace("\n", "\\n") + "]";
    }
}

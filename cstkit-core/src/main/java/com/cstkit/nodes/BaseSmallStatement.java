package com.cstkit.nodes;

import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;

import java.util.Objects;

/**
 * A statement that can share a line with others, separated by semicolons.
 *
 * <p>A {@link MaybeSentinel#DEFAULT} semicolon renders as {@code "; "} when
 * another small statement follows on the line and as nothing otherwise.</p>
 */
public abstract class BaseSmallStatement extends CstNode {

    private final MaybeSentinel<Semicolon> semicolon;

    protected BaseSmallStatement(MaybeSentinel<Semicolon> semicolon) {
        this.semicolon = Objects.requireNonNull(semicolon, "semicolon");
    }

    public MaybeSentinel<Semicolon> semicolon() {
        return semicolon;
    }

    public abstract BaseSmallStatement withSemicolon(MaybeSentinel<Semicolon> semicolon);

    /**
     * Renders this statement as one of several on a line.
     *
     * @param defaultSemicolon whether a defaulted semicolon must still separate
     *                         this statement from the next one
     */
    public final void codegen(CodegenState state, boolean defaultSemicolon) {
        try (CodegenState.PositionScope ignored = state.recordSyntacticPosition(this)) {
            codegenImpl(state, defaultSemicolon);
        }
    }

    @Override
    protected final void codegenImpl(CodegenState state) {
        codegenImpl(state, false);
    }

    private void codegenImpl(CodegenState state, boolean defaultSemicolon) {
        CodePosition start = state.position();
        codegenBody(state);
        state.recordPosition(this, new CodeRange(start, state.position()));

        if (semicolon instanceof MaybeSentinel.Value<Semicolon> value) {
            value.node().codegen(state);
        } else if (defaultSemicolon) {
            state.addToken("; ");
        }
    }

    /**
     * Emits the statement itself, without its semicolon.
     */
    protected abstract void codegenBody(CodegenState state);
}

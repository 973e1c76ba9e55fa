package com.cstkit.codegen;

import com.cstkit.nodes.Name;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodegenStateTest {

    private static CodegenState newState() {
        return new CodegenState("    ", "\n");
    }

    @Test
    @DisplayName("Cursor follows tokens across LF, CRLF and trailing text")
    void cursorArithmetic() {
        CodegenState state = newState();
        assertEquals(new CodePosition(1, 0), state.position());

        state.addToken("abc");
        assertEquals(new CodePosition(1, 3), state.position());

        state.addToken("de\nfgh");
        assertEquals(new CodePosition(2, 3), state.position());

        state.addToken("\r\n");
        assertEquals(new CodePosition(3, 0), state.position());

        state.addToken("x");
        assertEquals(new CodePosition(3, 1), state.position());

        assertEquals("abcde\nfgh\r\nx", state.code());
    }

    @Test
    void loneCarriageReturnsCountAsLineBreaks() {
        CodegenState state = newState();
        state.addToken("a\r\rbc");
        assertEquals(3, state.line());
        assertEquals(2, state.column());
    }

    @Test
    void crlfCountsAsSingleLineBreak() {
        CodegenState state = newState();
        state.addToken("a\r\nb\n\rc");
        // \r\n, then \n, then \r
        assertEquals(4, state.line());
        assertEquals(1, state.column());
    }

    @Test
    void emptyTokenDoesNotMoveCursor() {
        CodegenState state = newState();
        state.addToken("ab");
        state.addToken("");
        assertEquals(new CodePosition(1, 2), state.position());
        assertEquals(List.of("ab", ""), state.tokens());
    }

    @Test
    @DisplayName("Indent push, emit, pop leaves emitted indentation in place")
    void indentBalance() {
        CodegenState state = newState();
        state.increaseIndent("  ");
        state.addIndentTokens();
        state.decreaseIndent();

        assertTrue(state.indentTokens().isEmpty(), "Indent stack should be empty again");
        assertEquals(List.of("  "), state.tokens());
        assertEquals(new CodePosition(1, 2), state.position());
    }

    @Test
    void indentTokensAreEmittedOuterToInner() {
        CodegenState state = newState();
        state.increaseIndent("\t");
        state.increaseIndent("  ");
        state.addIndentTokens();

        assertEquals(List.of("\t", "  "), state.tokens());
        assertEquals(3, state.column());
    }

    @Test
    void decreaseIndentOnEmptyStackFails() {
        CodegenState state = newState();
        assertThrows(CstUsageException.class, state::decreaseIndent);
    }

    @Test
    void indentScopeRestoresStackOnFailure() {
        CodegenState state = newState();
        state.increaseIndent("a");

        assertThrows(IllegalStateException.class, () -> {
            try (CodegenState.IndentScope ignored = state.indent("b")) {
                assertEquals(List.of("a", "b"), state.indentTokens());
                throw new IllegalStateException("render failed");
            }
        });

        assertEquals(List.of("a"), state.indentTokens());
    }

    @Test
    void indentScopeDetectsUnbalancedPush() {
        CodegenState state = newState();
        CodegenState.IndentScope scope = state.indent("a");
        state.increaseIndent("b");

        assertThrows(CstUsageException.class, scope::close);
        assertTrue(state.indentTokens().isEmpty(), "Leaked push is popped with the scope");
    }

    @Test
    void indentScopeRestoresStackWhenFailureLeaksPush() {
        CodegenState state = newState();
        state.increaseIndent("a");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> {
            try (CodegenState.IndentScope ignored = state.indent("b")) {
                state.increaseIndent("c");
                throw new IllegalStateException("render failed");
            }
        });

        assertEquals(List.of("a"), state.indentTokens());
        assertEquals(1, e.getSuppressed().length);
        assertInstanceOf(CstUsageException.class, e.getSuppressed()[0]);
    }

    @Test
    @DisplayName("First recorded range wins for a node and provider")
    void firstWriteWins() {
        CodegenState state = newState();
        Name node = new Name("x");
        CodeRange first = CodeRange.create(1, 0, 1, 1);
        CodeRange second = CodeRange.create(5, 2, 5, 3);

        state.recordPosition(node, first);
        state.recordPosition(node, second);

        assertEquals(first, node.position(PositionProvider.BASIC).orElseThrow());
        assertTrue(node.position(PositionProvider.SYNTACTIC).isEmpty());
    }

    @Test
    void rangesFromDifferentProvidersCoexist() {
        Name node = new Name("x");
        CodeRange basic = CodeRange.create(1, 0, 1, 1);
        newState().recordPosition(node, basic);

        SyntacticCodegenState syntactic = new SyntacticCodegenState("    ", "\n");
        try (CodegenState.PositionScope ignored = syntactic.recordSyntacticPosition(node)) {
            syntactic.addToken("xy");
        }

        assertEquals(basic, node.position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(1, 0, 1, 2), node.position(PositionProvider.SYNTACTIC).orElseThrow());
        assertEquals(2, node.metadata().asMap().size());
    }

    @Test
    void basicSyntacticScopeRecordsNothing() {
        CodegenState state = newState();
        Name node = new Name("x");
        try (CodegenState.PositionScope ignored = state.recordSyntacticPosition(node)) {
            state.addToken("x");
        }
        assertTrue(node.metadata().isEmpty());
    }

    @Test
    void popTrailingNewlineRestoresCursor() {
        CodegenState state = newState();
        state.addToken("ab");
        state.addToken("\r\n");
        assertEquals(new CodePosition(2, 0), state.position());

        assertTrue(state.popTrailingNewline());
        assertEquals("ab", state.code());
        assertEquals(new CodePosition(1, 2), state.position());

        assertFalse(state.popTrailingNewline(), "'ab' is not a newline");
        assertEquals("ab", state.code());
    }

    @Test
    void consecutivePopsReplayTheBuffer() {
        CodegenState state = newState();
        state.addToken("a");
        state.addToken("\n");
        state.addToken("\n");

        assertTrue(state.popTrailingNewline());
        assertEquals(new CodePosition(2, 0), state.position());
        assertTrue(state.popTrailingNewline());
        assertEquals(new CodePosition(1, 1), state.position());
        assertEquals("a", state.code());
    }

    @Test
    void popOnEmptyBufferIsNoop() {
        CodegenState state = newState();
        assertFalse(state.popTrailingNewline());
        assertEquals(new CodePosition(1, 0), state.position());
    }

    @Test
    void providersCreateMatchingStates() {
        CodegenState basic = PositionProvider.BASIC.createState("  ", "\r\n");
        CodegenState syntactic = PositionProvider.SYNTACTIC.createState("  ", "\r\n");

        assertSame(PositionProvider.BASIC, basic.provider());
        assertSame(PositionProvider.SYNTACTIC, syntactic.provider());
        assertInstanceOf(SyntacticCodegenState.class, syntactic);
        assertEquals("  ", syntactic.defaultIndent());
        assertEquals("\r\n", syntactic.defaultNewline());
    }

    @Test
    void providerRejectsStateRecordingElsewhere() {
        PositionProvider custom = new PositionProvider("Custom", CodegenState::new);
        assertThrows(CstUsageException.class, () -> custom.createState("    ", "\n"));
    }
}

package com.cstkit.codegen;

import com.cstkit.nodes.CstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mutable state for a single render pass.
 *
 * <p>Nodes emit their literal text through {@link #addToken(String)} and
 * {@link #addIndentTokens()}; the state keeps the output buffer, the stack of
 * indentation tokens and the live line/column cursor. Ranges recorded through
 * {@link #recordPosition(CstNode, CodeRange)} are stored on the node under
 * {@link #provider()} and never overwrite an earlier range from that provider.</p>
 *
 * <p>A state belongs to exactly one render pass on one thread. Create a new
 * one for every pass.</p>
 */
public class CodegenState {

    private static final Pattern NEWLINE = Pattern.compile("\\r\\n?|\\n");

    private static final PositionScope NO_SCOPE = () -> { };

    private final String defaultIndent;
    private final String defaultNewline;
    private final PositionProvider provider;

    private final List<String> indentTokens = new ArrayList<>();
    private final List<String> tokens = new ArrayList<>();

    private int line = 1;   // one-indexed
    private int column = 0; // zero-indexed

    // Cursor before the most recent token, for popTrailingNewline()
    private int previousLine = 1;
    private int previousColumn = 0;
    private boolean hasPrevious = false;

    public CodegenState(String defaultIndent, String defaultNewline) {
        this(defaultIndent, defaultNewline, PositionProvider.BASIC);
    }

    protected CodegenState(String defaultIndent, String defaultNewline, PositionProvider provider) {
        this.defaultIndent = Objects.requireNonNull(defaultIndent, "defaultIndent");
        this.defaultNewline = Objects.requireNonNull(defaultNewline, "defaultNewline");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public String defaultIndent() {
        return defaultIndent;
    }

    public String defaultNewline() {
        return defaultNewline;
    }

    public PositionProvider provider() {
        return provider;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public CodePosition position() {
        return new CodePosition(line, column);
    }

    /**
     * Indentation tokens currently in effect, outermost first.
     */
    public List<String> indentTokens() {
        return Collections.unmodifiableList(indentTokens);
    }

    /**
     * Everything emitted so far, in order.
     */
    public List<String> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public String code() {
        return String.join("", tokens);
    }

    // ==================== Indentation ====================

    public void increaseIndent(String value) {
        indentTokens.add(Objects.requireNonNull(value, "indent token"));
    }

    public void decreaseIndent() {
        if (indentTokens.isEmpty()) {
            throw new CstUsageException("decreaseIndent() called with an empty indent stack");
        }
        indentTokens.remove(indentTokens.size() - 1);
    }

    /**
     * Pushes {@code value} and returns a scope that pops it again when closed.
     * <pre>{@code
     * try (CodegenState.IndentScope ignored = state.indent(token)) {
     *     body.forEach(stmt -> stmt.codegen(state));
     * }
     * }</pre>
     */
    public IndentScope indent(String value) {
        increaseIndent(value);
        int depth = indentTokens.size();
        return () -> {
            int found = indentTokens.size();
            // Back to the depth before this scope even when the inner pushes leaked
            while (indentTokens.size() >= depth) {
                decreaseIndent();
            }
            if (found != depth) {
                throw new CstUsageException(
                    "Unbalanced indentation: expected depth " + depth + " when closing scope, found " + found);
            }
        };
    }

    // ==================== Emission ====================

    public void addIndentTokens() {
        for (String token : indentTokens) {
            addToken(token);
        }
    }

    public void addToken(String value) {
        tokens.add(value);
        previousLine = line;
        previousColumn = column;
        hasPrevious = true;
        updatePosition(value);
    }

    /**
     * Removes the last emitted token if it is a single newline sequence and
     * moves the cursor back to where it was before that token.
     *
     * @return true if a newline was removed
     */
    public boolean popTrailingNewline() {
        if (tokens.isEmpty()) {
            return false;
        }
        String last = tokens.get(tokens.size() - 1);
        if (!NEWLINE.matcher(last).matches()) {
            return false;
        }
        tokens.remove(tokens.size() - 1);
        if (hasPrevious) {
            line = previousLine;
            column = previousColumn;
            hasPrevious = false;
        } else {
            // Second pop in a row, so replay the buffer
            line = 1;
            column = 0;
            for (String token : tokens) {
                updatePosition(token);
            }
        }
        return true;
    }

    /**
     * Advances the cursor over {@code value}. {@code \r\n}, {@code \r} and
     * {@code \n} each count as one line break; text after the last break
     * still occupies columns on the new line.
     */
    private void updatePosition(String value) {
        Matcher matcher = NEWLINE.matcher(value);
        int newlines = 0;
        int lastLineStart = 0;
        while (matcher.find()) {
            newlines++;
            lastLineStart = matcher.end();
        }
        if (newlines == 0) {
            column += value.length();
        } else {
            line += newlines;
            column = value.length() - lastLineStart;
        }
    }

    // ==================== Position recording ====================

    /**
     * Records {@code range} for {@code node} under this state's provider,
     * unless the node already holds a range from that provider. Nodes can be
     * shared between parents, so the first location rendered is kept.
     */
    public void recordPosition(CstNode node, CodeRange range) {
        node.metadata().recordIfAbsent(provider, range);
    }

    /**
     * Brackets the rendering of a single node. The basic strategy records
     * nothing here; nodes record their own coarse ranges through
     * {@link #recordPosition(CstNode, CodeRange)}.
     */
    public PositionScope recordSyntacticPosition(CstNode node) {
        return NO_SCOPE;
    }

    /**
     * A block opened by {@link #recordSyntacticPosition(CstNode)}.
     */
    @FunctionalInterface
    public interface PositionScope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * A block opened by {@link #indent(String)}.
     */
    @FunctionalInterface
    public interface IndentScope extends AutoCloseable {
        @Override
        void close();
    }
}

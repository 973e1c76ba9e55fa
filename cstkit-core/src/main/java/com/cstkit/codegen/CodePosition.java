package com.cstkit.codegen;

import java.util.Comparator;

/**
 * A cursor position in rendered source.
 *
 * @param line   one-based line number
 * @param column zero-based column offset
 */
public record CodePosition(int line, int column) implements Comparable<CodePosition> {

    private static final Comparator<CodePosition> ORDER =
        Comparator.comparingInt(CodePosition::line).thenComparingInt(CodePosition::column);

    public CodePosition {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0, got " + column);
        }
    }

    @Override
    public int compareTo(CodePosition other) {
        return ORDER.compare(this, other);
    }

    public boolean isAfter(CodePosition other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(CodePosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

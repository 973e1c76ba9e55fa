package com.cstkit.codegen;

/**
 * A half-open span of rendered source between two cursor positions.
 */
public record CodeRange(CodePosition start, CodePosition end) {

    public CodeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
    }

    public static CodeRange create(int startLine, int startColumn, int endLine, int endColumn) {
        return new CodeRange(new CodePosition(startLine, startColumn), new CodePosition(endLine, endColumn));
    }

    /**
     * Whether {@code other} lies entirely within this range (bounds inclusive).
     */
    public boolean contains(CodeRange other) {
        return start.compareTo(other.start) <= 0 && other.end.compareTo(end) <= 0;
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}

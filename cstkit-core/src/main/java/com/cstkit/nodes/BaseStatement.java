package com.cstkit.nodes;

import java.util.List;

/**
 * A statement occupying whole lines, preceded by its own blank and comment
 * lines.
 */
public abstract class BaseStatement extends CstNode {

    private final List<EmptyLine> leadingLines;

    protected BaseStatement(List<EmptyLine> leadingLines) {
        this.leadingLines = List.copyOf(leadingLines);
    }

    public List<EmptyLine> leadingLines() {
        return leadingLines;
    }
}

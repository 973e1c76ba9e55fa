package com.cstkit.codegen;

import com.cstkit.nodes.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Render state that records an exact range for every node it renders, under
 * {@link PositionProvider#SYNTACTIC}.
 */
public class SyntacticCodegenState extends CodegenState {

    // Nodes whose scope has closed during this render
    private final List<CstNode> recorded = new ArrayList<>();

    public SyntacticCodegenState(String defaultIndent, String defaultNewline) {
        super(defaultIndent, defaultNewline, PositionProvider.SYNTACTIC);
    }

    /**
     * Coarse ranges are not kept; every node gets its exact range from
     * {@link #recordSyntacticPosition(CstNode)} instead.
     */
    @Override
    public void recordPosition(CstNode node, CodeRange range) {
    }

    /**
     * Snapshots the cursor now and again when the scope closes, on any exit
     * path, and stores the span for {@code node}. One call per rendered
     * occurrence, so the latest occurrence's range is kept.
     */
    @Override
    public PositionScope recordSyntacticPosition(CstNode node) {
        CodePosition start = position();
        return () -> {
            node.metadata().record(provider(), new CodeRange(start, position()));
            recorded.add(node);
        };
    }

    /**
     * Removes the trailing newline and pulls every range already recorded
     * past the new cursor back to it, so closed children stay inside the
     * still-open parents.
     */
    @Override
    public boolean popTrailingNewline() {
        if (!super.popTrailingNewline()) {
            return false;
        }
        CodePosition after = position();
        for (CstNode node : recorded) {
            node.metadata().get(provider()).ifPresent(range -> {
                if (range.end().isAfter(after)) {
                    CodePosition start = range.start().isAfter(after) ? after : range.start();
                    node.metadata().record(provider(), new CodeRange(start, after));
                }
            });
        }
        return true;
    }
}

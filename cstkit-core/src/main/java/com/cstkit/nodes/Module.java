package com.cstkit.nodes;

import com.cstkit.codegen.CodegenState;
import com.cstkit.codegen.CstUsageException;
import com.cstkit.codegen.PositionProvider;
import com.cstkit.visitor.CstTraversal;
import com.cstkit.visitor.CstVisitor;
import com.cstkit.visitor.VisitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed source file, and the entry point for rendering.
 *
 * <p>Besides the statements it keeps the conventions detected in the source:
 * the indent used for blocks, the newline sequence, and whether the file ended
 * with a newline. {@link #code()} reproduces the parsed source exactly.</p>
 */
public final class Module extends CstNode {

    private static final Logger log = LoggerFactory.getLogger(Module.class);

    private final List<EmptyLine> header;
    private final List<BaseStatement> body;
    private final List<EmptyLine> footer;
    private final String defaultIndent;
    private final String defaultNewline;
    private final boolean hasTrailingNewline;

    public Module(List<EmptyLine> header, List<? extends BaseStatement> body, List<EmptyLine> footer,
                  String defaultIndent, String defaultNewline, boolean hasTrailingNewline) {
        this.header = List.copyOf(header);
        this.body = List.copyOf(body);
        this.footer = List.copyOf(footer);
        this.defaultIndent = Objects.requireNonNull(defaultIndent, "defaultIndent");
        this.defaultNewline = Objects.requireNonNull(defaultNewline, "defaultNewline");
        this.hasTrailingNewline = hasTrailingNewline;
    }

    public Module(List<? extends BaseStatement> body) {
        this(List.of(), body, List.of(), "    ", "\n", true);
    }

    public List<EmptyLine> header() {
        return header;
    }

    public List<BaseStatement> body() {
        return body;
    }

    public List<EmptyLine> footer() {
        return footer;
    }

    public String defaultIndent() {
        return defaultIndent;
    }

    public String defaultNewline() {
        return defaultNewline;
    }

    public boolean hasTrailingNewline() {
        return hasTrailingNewline;
    }

    public Module withBody(List<? extends BaseStatement> body) {
        return new Module(header, body, footer, defaultIndent, defaultNewline, hasTrailingNewline);
    }

    // ==================== Rendering ====================

    /**
     * Renders the whole module.
     */
    public String code() {
        return render(new CodegenState(defaultIndent, defaultNewline));
    }

    /**
     * Renders the whole module into {@code state}, which must be fresh.
     */
    public String render(CodegenState state) {
        if (!state.tokens().isEmpty()) {
            throw new CstUsageException("A CodegenState can only be used for one render pass");
        }
        codegen(state);
        return state.code();
    }

    /**
     * Renders {@code node} on its own, using this module's indent and newline.
     */
    public String codeForNode(CstNode node) {
        CodegenState state = new CodegenState(defaultIndent, defaultNewline);
        node.codegen(state);
        return state.code();
    }

    /**
     * Renders the module with the state belonging to {@code provider}, so that
     * every node it renders carries that provider's ranges afterwards.
     */
    public String resolvePositions(PositionProvider provider) {
        CodegenState state = provider.createState(defaultIndent, defaultNewline);
        String code = render(state);
        log.debug("Resolved {} positions over {} lines", provider, state.line());
        return code;
    }

    /**
     * Applies {@code visitor} to the whole tree.
     *
     * @throws CstUsageException if the visitor removes the module or replaces
     *                           it with something that is not a module
     */
    public Module rewrite(CstVisitor visitor) {
        VisitResult result = visit(visitor);
        CstNode node = result.resolve(this);
        if (node == null) {
            throw new CstUsageException("A Module cannot be removed");
        }
        if (!(node instanceof Module module)) {
            throw new CstUsageException("Expected a Module from the visitor, got a " + node.type());
        }
        return module;
    }

    @Override
    public List<CstNode> children() {
        return Children.of(header, body, footer);
    }

    @Override
    protected CstNode visitChildren(CstVisitor visitor) {
        return new Module(
            CstTraversal.visitSequence("header", header, visitor),
            CstTraversal.visitSequence("body", body, visitor),
            CstTraversal.visitSequence("footer", footer, visitor),
            defaultIndent,
            defaultNewline,
            hasTrailingNewline);
    }

    @Override
    protected void codegenImpl(CodegenState state) {
        for (EmptyLine line : header) {
            line.codegen(state);
        }
        for (BaseStatement stmt : body) {
            stmt.codegen(state);
        }
        for (EmptyLine line : footer) {
            line.codegen(state);
        }

        if (hasTrailingNewline) {
            if (state.tokens().isEmpty()) {
                // Nothing was rendered, keep the lone newline
                state.addToken(defaultNewline);
            }
        } else {
            state.popTrailingNewline();
        }
    }
}

package com.cstkit.nodes;

import com.cstkit.ModuleParser;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodegenState;
import com.cstkit.codegen.CstUsageException;
import com.cstkit.codegen.PositionProvider;
import com.cstkit.codegen.SyntacticCodegenState;
import com.cstkit.visitor.CstVisitor;
import com.cstkit.visitor.VisitResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleTest {

    private static CstVisitor remove(Predicate<CstNode> matches) {
        return new CstVisitor() {
            @Override
            public VisitResult onLeave(CstNode original, CstNode updated) {
                return matches.test(original) ? VisitResult.removed() : VisitResult.of(original, updated);
            }
        };
    }

    private static boolean isName(CstNode node, String value) {
        return node instanceof Name name && name.value().equals(value);
    }

    private static String rewrite(String source, CstVisitor visitor) {
        return ModuleParser.parse(source).rewrite(visitor).code();
    }

    // ==================== Transforms ====================

    @Test
    @DisplayName("Renaming keeps every other character in place")
    void renamePreservesFormatting() {
        CstVisitor rename = new CstVisitor() {
            @Override
            public VisitResult onLeave(CstNode original, CstNode updated) {
                if (isName(original, "a")) {
                    return VisitResult.replaced(new Name("renamed"));
                }
                return VisitResult.of(original, updated);
            }
        };
        assertEquals("# top\n\nif  renamed :  # x\n\trenamed ;b\r\n",
            rewrite("# top\n\nif  a :  # x\n\ta ;b\r\n", rename));
    }

    @Test
    void removingStatementDropsItsLeadingComments() {
        CstVisitor visitor = remove(node -> node instanceof SimpleStatementLine line
            && line.body().get(0) instanceof Expr expr && expr.value().value().equals("a"));
        assertEquals("b\n", rewrite("# about a\na\nb\n", visitor));
    }

    @Test
    void removingSemicolonRendersDefaultSeparator() {
        CstVisitor visitor = remove(node -> node instanceof Semicolon);
        assertEquals("a; b\n", rewrite("a  ;b\n", visitor));
        assertEquals("a  # c\n", rewrite("a;  # c\n", visitor));
    }

    @Test
    void removingElse() {
        assertEquals("if a:\n    b\n", rewrite("if a:\n    b\nelse:\n    c\n", remove(node -> node instanceof Else)));
    }

    @Test
    void removingRequiredTestFails() {
        Module module = ModuleParser.parse("if a:\n    b\n");
        CstUsageException e = assertThrows(CstUsageException.class, () -> module.rewrite(remove(node -> isName(node, "a"))));
        assertTrue(e.getMessage().contains("field 'test'"), e.getMessage());
    }

    @Test
    void emptiedBlockRendersPass() {
        CstVisitor visitor = remove(node -> node instanceof SimpleStatementLine);
        assertEquals("if a:\n    pass\n", rewrite("if a:\n    b\n    c\n", visitor));
    }

    @Test
    void emptiedLineRendersPass() {
        assertEquals("pass  # kept\n", rewrite("a; b  # kept\n", remove(node -> node instanceof Expr)));
    }

    @Test
    void skippedSubtreeIsLeftAlone() {
        CstVisitor visitor = new CstVisitor() {
            @Override
            public boolean onVisit(CstNode node) {
                return !(node instanceof If);
            }

            @Override
            public VisitResult onLeave(CstNode original, CstNode updated) {
                return original instanceof Expr ? VisitResult.removed() : VisitResult.of(original, updated);
            }
        };
        assertEquals("pass\nif b:\n    a\n", rewrite("a\nif b:\n    a\n", visitor));
    }

    @Test
    void unchangedRewriteReturnsSameTree() {
        Module module = ModuleParser.parse("if a:\n    b; c\nelse:\n    pass\n");
        assertSame(module, module.rewrite(new CstVisitor() { }));
    }

    @Test
    void rewriteRejectsRemovingModule() {
        Module module = ModuleParser.parse("a\n");
        assertThrows(CstUsageException.class, () -> module.rewrite(remove(node -> node instanceof Module)));
    }

    @Test
    void rewriteRejectsReplacingModuleWithOtherNode() {
        Module module = ModuleParser.parse("a\n");
        CstVisitor visitor = new CstVisitor() {
            @Override
            public VisitResult onLeave(CstNode original, CstNode updated) {
                return original instanceof Module ? VisitResult.replaced(new Name("x")) : VisitResult.of(original, updated);
            }
        };
        assertThrows(CstUsageException.class, () -> module.rewrite(visitor));
    }

    // ==================== Rendering ====================

    @Test
    void codeForNodeUsesModuleConventions() {
        Module module = ModuleParser.parse("if a:\r\n  b\r\n");
        If ifStatement = (If) module.body().get(0);
        assertEquals("if a:\r\n  b\r\n", module.codeForNode(ifStatement));
        assertEquals("b\r\n", module.codeForNode(ifStatement.body().body().get(0)));
    }

    @Test
    void renderRejectsUsedState() {
        Module module = ModuleParser.parse("a\n");
        CodegenState state = new CodegenState("    ", "\n");
        state.addToken("x");
        assertThrows(CstUsageException.class, () -> module.render(state));
    }

    @Test
    void renderWithSyntacticState() {
        Module module = ModuleParser.parse("a\n");
        assertEquals("a\n", module.render(new SyntacticCodegenState("    ", "\n")));
        assertTrue(module.position(PositionProvider.SYNTACTIC).isPresent());
    }

    @Test
    @DisplayName("Programmatically built trees render with default formatting")
    void rendersConstructedTree() {
        Module module = new Module(List.of(
            new If(new Name("ready"),
                new IndentedBlock(List.of(new SimpleStatementLine(List.of(new Expr(new Name("start")), new Expr(new Name("log")))))),
                new Else(new IndentedBlock(List.of())))));
        assertEquals("if ready:\n    start; log\nelse:\n    pass\n", module.code());
    }

    @Test
    void emptyModuleKeepsLoneNewline() {
        assertEquals("\n", new Module(List.of()).code());
    }

    // ==================== Basic positions ====================

    @Test
    void basicPositionsCoverStatementsWithoutTrivia() {
        Module module = ModuleParser.parse("if a:  # note\n    b; c  # x\n");
        module.code();

        If ifStatement = (If) module.body().get(0);
        SimpleStatementLine line = (SimpleStatementLine) ifStatement.body().body().get(0);

        assertEquals(CodeRange.create(1, 0, 1, 5), ifStatement.position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(1, 3, 1, 4), ifStatement.test().position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(2, 4, 2, 8), line.position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(2, 4, 2, 5), line.body().get(0).position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(2, 7, 2, 8), line.body().get(1).position(PositionProvider.BASIC).orElseThrow());
        assertTrue(module.position(PositionProvider.BASIC).isEmpty());
        assertTrue(line.trailingWhitespace().position(PositionProvider.BASIC).isEmpty());
    }

    @Test
    void basicPositionsKeepFirstOccurrenceOfSharedNode() {
        Module parsed = ModuleParser.parse("a\n");
        SimpleStatementLine shared = (SimpleStatementLine) parsed.body().get(0);
        Module module = parsed.withBody(List.of(shared, shared));

        assertEquals("a\na\n", module.resolvePositions(PositionProvider.BASIC));
        assertEquals(CodeRange.create(1, 0, 1, 1), shared.position(PositionProvider.BASIC).orElseThrow());
    }

    @Test
    void providersAreRecordedSideBySide() {
        Module module = ModuleParser.parse("a\n");
        module.resolvePositions(PositionProvider.BASIC);
        module.resolvePositions(PositionProvider.SYNTACTIC);

        SimpleStatementLine line = (SimpleStatementLine) module.body().get(0);
        assertEquals(CodeRange.create(1, 0, 1, 1), line.position(PositionProvider.BASIC).orElseThrow());
        assertEquals(CodeRange.create(1, 0, 2, 0), line.position(PositionProvider.SYNTACTIC).orElseThrow());
        assertEquals(2, line.metadata().asMap().size());
    }
}

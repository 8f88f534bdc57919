package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.semantics.analysis.IAnalysisHandler;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Performs semantic analysis of one code block. It checks scoping, arity and placement rules
 * and records which declaration every identifier refers to.
 * <p>
 * Analysis runs in two passes: pass 1 builds all scopes and registers functions so that they are
 * visible in their whole block, pass 2 traverses the statements, dispatches each node to its
 * handler and declares variables in order. Expressions are not traversed generically; the
 * handlers check them through the {@link ExpressionChecker}.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final AnalysisHandlerRegistry registry;

    /**
     * @param dialect     The dialect providing builtins.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param dataNames   The object and data names visible to {@code datasize}/{@code dataoffset}.
     */
    public SemanticAnalyzer(Dialect dialect, DiagnosticsEngine diagnostics, Set<String> dataNames) {
        this.diagnostics = diagnostics;
        this.symbolTable = new SymbolTable(dialect, diagnostics);
        ExpressionChecker expressions = new ExpressionChecker(dialect, symbolTable, diagnostics, dataNames);
        this.registry = AnalysisHandlerRegistry.initializeWithDefaults(expressions);
    }

    /**
     * Analyzes the block. Errors are reported to the diagnostics engine; the returned info is
     * only complete if no error was reported.
     *
     * @param code The code block of an object.
     * @return The collected analysis info.
     */
    public AnalysisInfo analyze(Block code) {
        new ScopeFiller(symbolTable, diagnostics, registry).fill(code, null);
        symbolTable.setCurrentScope(null);
        traverseAndAnalyze(List.of(code));
        return symbolTable.getAnalysisInfo();
    }

    private void traverseAndAnalyze(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<IAnalysisHandler> handler = registry.resolveHandler(node.getClass());
            handler.ifPresent(h -> h.analyze(node, symbolTable, diagnostics));
            for (AstNode child : node.getChildren()) {
                if (child instanceof Statement || child instanceof Case) {
                    handler.ifPresent(h -> h.beforeChild(node, child, symbolTable, diagnostics));
                    traverseAndAnalyze(List.of(child));
                }
            }
            handler.ifPresent(h -> h.afterChildren(node, symbolTable, diagnostics));
        }
    }

    /**
     * Gets the handler registry for external registration of additional handlers.
     * @return The analysis handler registry
     */
    public AnalysisHandlerRegistry getRegistry() {
        return registry;
    }
}

package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.semantics.ControlContext;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.Scope;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

/**
 * Tracks the loop part being analyzed and checks the condition inside the scope of the init block,
 * after the init block has declared its variables.
 */
public class ForLoopAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public ForLoopAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.pushContext(ControlContext.LOOP_INIT);
    }

    @Override
    public void beforeChild(AstNode node, AstNode child, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ForLoop loop = (ForLoop) node;
        if (child == loop.post()) {
            Scope outer = symbolTable.getCurrentScope();
            symbolTable.setCurrentScope(symbolTable.scopeOf(loop.pre()));
            expressions.expectSingleValue(loop.condition());
            symbolTable.setCurrentScope(outer);

            symbolTable.popContext();
            symbolTable.pushContext(ControlContext.LOOP_POST);
        } else if (child == loop.body()) {
            symbolTable.popContext();
            symbolTable.pushContext(ControlContext.LOOP_BODY);
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.popContext();
    }
}

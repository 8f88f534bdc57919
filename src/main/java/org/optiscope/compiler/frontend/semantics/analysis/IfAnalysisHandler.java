package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

public class IfAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public IfAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        expressions.expectSingleValue(((If) node).condition());
    }
}

package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

public class ExpressionStatementAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public ExpressionStatementAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ExpressionStatement statement = (ExpressionStatement) node;
        int values = expressions.check(statement.expression());
        if (values != 0) {
            diagnostics.reportError("Top-level expressions are not supposed to return values (this expression returns "
                    + values + " value" + (values == 1 ? "" : "s") + "). Use ``pop()`` or assign them.",
                    statement.location());
        }
    }
}

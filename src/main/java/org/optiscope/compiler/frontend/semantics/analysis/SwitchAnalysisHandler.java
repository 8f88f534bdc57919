package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

/**
 * Checks the switch expression and the case values: at least one case, no duplicate values.
 */
public class SwitchAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public SwitchAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Switch switchStatement = (Switch) node;
        expressions.expectSingleValue(switchStatement.expression());

        if (switchStatement.cases().isEmpty()) {
            diagnostics.reportError("Switch statement without any cases.", switchStatement.location());
            return;
        }
        if (switchStatement.cases().size() == 1 && switchStatement.cases().get(0).isDefault()) {
            diagnostics.reportWarning("Switch statement with only a default case.", switchStatement.location());
        }

        Set<BigInteger> values = new HashSet<>();
        for (Case switchCase : switchStatement.cases()) {
            if (switchCase.isDefault()) continue;
            expressions.checkLiteral(switchCase.value());
            if (!values.add(switchCase.value().numericValue())) {
                diagnostics.reportError("Duplicate case \"" + switchCase.value().value() + "\" defined.",
                        switchCase.location());
            }
        }
    }
}

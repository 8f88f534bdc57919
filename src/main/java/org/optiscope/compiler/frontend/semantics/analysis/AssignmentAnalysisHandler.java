package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.Symbol;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

public class AssignmentAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public AssignmentAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Assignment assignment = (Assignment) node;
        int values = expressions.check(assignment.value());
        int targets = assignment.variableNames().size();
        if (values != targets) {
            diagnostics.reportError("Variable count does not match number of values (" + targets + " vs. "
                    + values + ")", assignment.location());
        }

        Set<String> seen = new HashSet<>();
        for (Identifier target : assignment.variableNames()) {
            if (!seen.add(target.name())) {
                diagnostics.reportError("Variable \"" + target.name()
                        + "\" occurs multiple times on the left-hand side of the assignment.", target.location());
            }
            Optional<Symbol> symbol = symbolTable.resolve(target);
            if (symbol.isEmpty() || symbol.get().isFunction()) {
                diagnostics.reportError("Variable \"" + target.name() + "\" not found or not an lvalue.",
                        target.location());
            }
        }
    }
}

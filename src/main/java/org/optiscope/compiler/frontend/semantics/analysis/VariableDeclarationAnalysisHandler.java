package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.frontend.semantics.ExpressionChecker;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

import java.util.stream.Collectors;

/**
 * Checks the initial value of a {@code let} before declaring its variables, so the value
 * cannot refer to the variables being declared.
 */
public class VariableDeclarationAnalysisHandler implements IAnalysisHandler {

    private final ExpressionChecker expressions;

    public VariableDeclarationAnalysisHandler(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VariableDeclaration declaration = (VariableDeclaration) node;
        int variables = declaration.variables().size();
        if (declaration.value() != null) {
            int values = expressions.check(declaration.value());
            if (values != variables) {
                String names = declaration.variables().stream().map(TypedName::name).collect(Collectors.joining(", "));
                diagnostics.reportError("Variable count mismatch for declaration of \"" + names + "\": "
                        + variables + " variables and " + values + " values.", declaration.location());
            }
        }
        for (TypedName variable : declaration.variables()) {
            symbolTable.defineVariable(variable);
        }
    }
}

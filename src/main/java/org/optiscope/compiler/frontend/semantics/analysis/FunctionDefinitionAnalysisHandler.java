package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.semantics.ControlContext;
import org.optiscope.compiler.frontend.semantics.Scope;
import org.optiscope.compiler.frontend.semantics.Symbol;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Opens the parameter scope of a function and declares its parameters and return variables.
 */
public class FunctionDefinitionAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FunctionDefinition function = (FunctionDefinition) node;
        if (symbolTable.currentContext() == ControlContext.LOOP_INIT) {
            diagnostics.reportError("Functions cannot be defined inside a for-loop init block.", function.location());
        }
        Scope enclosing = symbolTable.getCurrentScope();
        for (Scope scope = enclosing == null ? null : enclosing.getParent(); scope != null; scope = scope.getParent()) {
            Optional<Symbol> outer = scope.lookupLocal(function.name());
            if (outer.isPresent() && !outer.get().isFunction()) {
                diagnostics.reportError("Function name \"" + function.name() + "\" already taken in this scope.",
                        function.location());
                break;
            }
        }

        symbolTable.setCurrentScope(symbolTable.scopeOf(function));
        for (TypedName parameter : function.parameters()) {
            symbolTable.defineVariable(parameter);
        }
        for (TypedName returnVariable : function.returnVariables()) {
            symbolTable.defineVariable(returnVariable);
        }
        symbolTable.pushContext(ControlContext.FUNCTION);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.popContext();
        symbolTable.setCurrentScope(symbolTable.scopeOf(node).getParent());
    }
}

package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.semantics.Scope;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

/**
 * Re-enters the scope pass 1 built for a block and restores the enclosing scope afterwards.
 */
public class BlockAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.setCurrentScope(symbolTable.scopeOf(node));
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Scope scope = symbolTable.scopeOf(node);
        symbolTable.setCurrentScope(scope.getParent());
    }
}

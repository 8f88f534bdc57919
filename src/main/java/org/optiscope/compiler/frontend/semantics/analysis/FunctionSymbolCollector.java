package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

/**
 * Registers a function in the scope of the block that defines it.
 */
public class FunctionSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.defineFunction((FunctionDefinition) node, symbolTable.getCurrentScope());
    }
}

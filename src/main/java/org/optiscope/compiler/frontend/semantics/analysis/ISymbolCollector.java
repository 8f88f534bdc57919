package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

/**
 * Pass-1 collector: registers symbols that must be visible in a whole block before the
 * block's statements are analyzed. Collectors run with the block's scope as current scope.
 */
public interface ISymbolCollector {

    /**
     * @param node        A direct statement of the block being filled.
     * @param symbolTable The symbol table whose current scope is the block's scope.
     * @param diagnostics The engine for reporting errors.
     */
    void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}

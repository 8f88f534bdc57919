package org.optiscope.compiler.frontend.semantics.analysis;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.semantics.ControlContext;
import org.optiscope.compiler.frontend.semantics.SymbolTable;

/**
 * Validates the placement of {@code break}, {@code continue} and {@code leave}.
 */
public class ControlFlowAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof Leave) {
            if (!symbolTable.insideFunction()) {
                diagnostics.reportError("Keyword \"leave\" can only be used inside a function.", node.location());
            }
            return;
        }
        if (symbolTable.currentContext() != ControlContext.LOOP_BODY) {
            String keyword = node.getClass().getSimpleName().toLowerCase();
            diagnostics.reportError("Keyword \"" + keyword + "\" needs to be inside a for-loop body.", node.location());
        }
    }
}

package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.semantics.analysis.ISymbolCollector;

import java.util.Optional;

/**
 * Pass 1: builds the scope of every block and function definition and runs the registered symbol
 * collectors for the statements of each block before any statement is analyzed. This makes
 * functions visible in their whole block, including before their definition.
 */
class ScopeFiller {

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final AnalysisHandlerRegistry registry;

    ScopeFiller(SymbolTable symbolTable, DiagnosticsEngine diagnostics, AnalysisHandlerRegistry registry) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.registry = registry;
    }

    Scope fill(Block block, Scope parent) {
        Scope scope = symbolTable.createScope(block, parent, false);
        symbolTable.setCurrentScope(scope);
        for (Statement statement : block.statements()) {
            Optional<ISymbolCollector> collector = registry.resolveCollector(statement.getClass());
            collector.ifPresent(c -> c.collect(statement, symbolTable, diagnostics));
        }
        for (Statement statement : block.statements()) {
            fillStatement(statement, scope);
        }
        return scope;
    }

    private void fillStatement(Statement statement, Scope scope) {
        if (statement instanceof Block nested) {
            fill(nested, scope);
        } else if (statement instanceof If ifStatement) {
            fill(ifStatement.body(), scope);
        } else if (statement instanceof Switch switchStatement) {
            for (Case switchCase : switchStatement.cases()) {
                fill(switchCase.body(), scope);
            }
        } else if (statement instanceof ForLoop loop) {
            Scope preScope = fill(loop.pre(), scope);
            fill(loop.post(), preScope);
            fill(loop.body(), preScope);
        } else if (statement instanceof FunctionDefinition function) {
            Scope functionScope = symbolTable.createScope(function, scope, true);
            fill(function.body(), functionScope);
        }
    }
}

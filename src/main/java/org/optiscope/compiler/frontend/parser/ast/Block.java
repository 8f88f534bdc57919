package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

/**
 * A braced sequence of statements opening a new scope.
 *
 * @param statements The statements in order.
 * @param location   The position of the opening brace.
 */
public record Block(List<Statement> statements, SourceLocation location) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    public static Block empty(SourceLocation location) {
        return new Block(List.of(), location);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}

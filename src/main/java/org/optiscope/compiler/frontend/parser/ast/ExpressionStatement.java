package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

/**
 * An expression evaluated for its side effects. Must yield no values.
 */
public record ExpressionStatement(Expression expression, SourceLocation location) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}

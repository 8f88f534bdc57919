package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

public record If(Expression condition, Block body, SourceLocation location) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}

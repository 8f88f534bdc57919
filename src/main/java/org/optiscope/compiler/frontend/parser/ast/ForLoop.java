package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

/**
 * A {@code for { pre } condition { post } { body }} loop. Variables declared in {@code pre}
 * are visible in the condition, the post block and the body.
 */
public record ForLoop(Block pre, Expression condition, Block post, Block body, SourceLocation location)
        implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(pre, condition, post, body);
    }
}

package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

/**
 * One branch of a {@link Switch}.
 *
 * @param value    The case literal, or {@code null} for the {@code default} branch.
 * @param body     The branch body.
 * @param location The source position.
 */
public record Case(Literal value, Block body, SourceLocation location) implements AstNode {

    public boolean isDefault() {
        return value == null;
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of(body) : List.of(value, body);
    }
}

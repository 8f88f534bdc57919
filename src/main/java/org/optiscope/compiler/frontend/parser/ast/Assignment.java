package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * An assignment {@code a, b := value}.
 *
 * @param variableNames The assigned variables.
 * @param value         The assigned value.
 * @param location      The source position.
 */
public record Assignment(List<Identifier> variableNames, Expression value, SourceLocation location)
        implements Statement {

    public Assignment {
        variableNames = List.copyOf(variableNames);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(variableNames);
        children.add(value);
        return children;
    }
}

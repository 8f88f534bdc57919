package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code let} statement.
 *
 * @param variables The declared variables, at least one.
 * @param value     The initial value, or {@code null} for zero-initialized variables.
 * @param location  The source position of {@code let}.
 */
public record VariableDeclaration(List<TypedName> variables, Expression value, SourceLocation location)
        implements Statement {

    public VariableDeclaration {
        variables = List.copyOf(variables);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(variables);
        if (value != null) {
            children.add(value);
        }
        return children;
    }
}

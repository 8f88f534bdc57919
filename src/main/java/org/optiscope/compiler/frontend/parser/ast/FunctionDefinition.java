package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition {@code function name(params) -> returns { body }}.
 */
public record FunctionDefinition(
        String name,
        List<TypedName> parameters,
        List<TypedName> returnVariables,
        Block body,
        SourceLocation location
) implements Statement {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        returnVariables = List.copyOf(returnVariables);
    }

    public FunctionDefinition withBody(Block newBody) {
        return new FunctionDefinition(name, parameters, returnVariables, newBody, location);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.addAll(returnVariables);
        children.add(body);
        return children;
    }
}

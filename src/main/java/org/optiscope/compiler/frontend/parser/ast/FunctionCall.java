package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a builtin or user-defined function.
 *
 * @param functionName The callee.
 * @param arguments    The arguments in source order (evaluated right to left).
 * @param location     The source position.
 */
public record FunctionCall(Identifier functionName, List<Expression> arguments, SourceLocation location)
        implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    public static FunctionCall of(String name, SourceLocation location, Expression... arguments) {
        return new FunctionCall(new Identifier(name, location), List.of(arguments), location);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(functionName);
        children.addAll(arguments);
        return children;
    }
}

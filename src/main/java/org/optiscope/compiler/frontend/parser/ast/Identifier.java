package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

/**
 * A reference to a variable or, as the callee of a {@link FunctionCall}, to a function.
 *
 * @param name     The referenced name.
 * @param location The source position.
 */
public record Identifier(String name, SourceLocation location) implements Expression {
}

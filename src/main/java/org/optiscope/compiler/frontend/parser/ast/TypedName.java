package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

/**
 * A declared name: a variable in a {@code let}, a function parameter or a return variable.
 *
 * @param name     The declared name.
 * @param location The source position.
 */
public record TypedName(String name, SourceLocation location) implements AstNode {
}

package org.optiscope.compiler.frontend.parser.ast;

/**
 * Marker for nodes that evaluate to values: literals, identifiers and function calls.
 */
public interface Expression extends AstNode {
}

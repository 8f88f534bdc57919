package org.optiscope.compiler.frontend.parser.ast;

/**
 * Marker for nodes that may appear in a {@link Block}.
 */
public interface Statement extends AstNode {
}

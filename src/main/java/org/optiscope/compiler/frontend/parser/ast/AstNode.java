package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.List;

/**
 * Base interface of all nodes of the code-block AST. Nodes are immutable; transformations
 * build new trees and keep the location of the node they were derived from.
 */
public interface AstNode {

    /**
     * @return The position this node originated from.
     */
    SourceLocation location();

    /**
     * Returns the direct children of this node in source order.
     * Leaf nodes return an empty list.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}

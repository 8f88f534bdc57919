package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

/**
 * The {@code leave} statement.
 */
public record Leave(SourceLocation location) implements Statement {
}

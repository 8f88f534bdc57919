package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

/**
 * The {@code break} statement.
 */
public record Break(SourceLocation location) implements Statement {
}

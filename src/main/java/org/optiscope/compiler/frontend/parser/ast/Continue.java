package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

/**
 * The {@code continue} statement.
 */
public record Continue(SourceLocation location) implements Statement {
}

package org.optiscope.compiler.diagnostics;

import org.optiscope.compiler.model.SourceLocation;

/**
 * A single error or warning reported by the front end or the analyzer.
 *
 * @param type     The severity.
 * @param message  The human-readable message.
 * @param location Where the problem was found, {@link SourceLocation#NONE} if unknown.
 */
public record Diagnostic(Type type, String message, SourceLocation location) {

    public enum Type {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        if (location.isKnown()) {
            return "[" + type + "] " + location + ": " + message;
        }
        return "[" + type + "] " + message;
    }
}

package org.optiscope.compiler.diagnostics;

import java.util.List;

/**
 * Thrown when the source text cannot be lexed or parsed. Always fatal for the session.
 */
public class ParseException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public ParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}

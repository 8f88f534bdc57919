package org.optiscope.compiler.diagnostics;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics during lexing, parsing and semantic analysis.
 * One engine is used per phase run; callers check {@link #hasErrors()} at phase boundaries.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param message  The error message.
     * @param location The position of the offending code.
     */
    public void reportError(String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, location));
    }

    /**
     * Reports a warning.
     * @param message  The warning message.
     * @param location The position of the offending code.
     */
    public void reportWarning(String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, location));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all errors only, in reporting order.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    /**
     * Builds a one-diagnostic-per-line summary.
     * @return The summary text, empty if nothing was reported.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append(System.lineSeparator());
        }
        return sb.toString();
    }
}

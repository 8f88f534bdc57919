package org.optiscope.compiler.diagnostics;

import java.util.List;

/**
 * Thrown when an object's code fails semantic analysis, either on initial validation or after a
 * transformation step.
 */
public class AnalysisException extends RuntimeException {

    private final String objectPath;
    private final List<Diagnostic> diagnostics;

    /**
     * @param objectPath  The qualified path of the object whose code is invalid.
     * @param diagnostics The errors reported by the analyzer; never empty.
     */
    public AnalysisException(String objectPath, List<Diagnostic> diagnostics) {
        super("Invalid code in object '" + objectPath + "' (" + diagnostics.size() + " error(s))");
        this.objectPath = objectPath;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getObjectPath() {
        return objectPath;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}

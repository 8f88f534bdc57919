package org.optiscope.compiler.diagnostics;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders diagnostics with their source position, the offending source line and a caret
 * under the reported column.
 */
public final class DiagnosticFormatter {

    private final String[] sourceLines;

    /**
     * @param source The source text the diagnostics refer to, or {@code null} to print positions only.
     */
    public DiagnosticFormatter(String source) {
        this.sourceLines = source == null ? new String[0] : source.split("\n", -1);
    }

    public void print(List<Diagnostic> diagnostics, PrintWriter out) {
        for (Diagnostic diagnostic : diagnostics) {
            print(diagnostic, out);
        }
        out.flush();
    }

    public void print(Diagnostic diagnostic, PrintWriter out) {
        out.println(diagnostic);
        int line = diagnostic.location().line();
        if (line < 1 || line > sourceLines.length) {
            return;
        }
        String text = sourceLines[line - 1].replace("\t", " ");
        out.println("    " + text);
        int column = Math.max(1, Math.min(diagnostic.location().column(), text.length() + 1));
        out.println("    " + " ".repeat(column - 1) + "^");
    }
}

package org.optiscope.compiler.model;

/**
 * A position in a source file. Lines and columns are 1-based; {@link #NONE} marks synthesized code.
 *
 * @param fileName The logical name of the source the position belongs to.
 * @param line     The 1-based line number, or 0 if unknown.
 * @param column   The 1-based column number, or 0 if unknown.
 */
public record SourceLocation(String fileName, int line, int column) {

    public static final SourceLocation NONE = new SourceLocation("", 0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}

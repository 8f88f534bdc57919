package org.optiscope.compiler.model;

/**
 * A single token of the source text.
 *
 * @param type     The token type.
 * @param text     The exact source text of the token.
 * @param value    The decoded value for string literals (the unescaped text), otherwise {@code null}.
 * @param line     The 1-based line.
 * @param column   The 1-based column.
 * @param fileName The logical source name.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    public SourceLocation location() {
        return new SourceLocation(fileName, line, column);
    }

    @Override
    public String toString() {
        return type + " '" + text + "' at " + line + ":" + column;
    }
}

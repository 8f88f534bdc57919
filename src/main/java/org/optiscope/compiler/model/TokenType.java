package org.optiscope.compiler.model;

/**
 * Defines the types of tokens produced by the lexer.
 * Object-level words ({@code object}, {@code code}, {@code data}) are contextual and lexed as identifiers.
 */
public enum TokenType {
    // Punctuation
    LEFT_BRACE, RIGHT_BRACE, LEFT_PAREN, RIGHT_PAREN, COMMA, ASSIGN, ARROW,

    // Literals
    IDENTIFIER, NUMBER, STRING, HEX_STRING,

    // Keywords
    LET, FUNCTION, IF, SWITCH, CASE, DEFAULT, FOR, BREAK, CONTINUE, LEAVE, TRUE, FALSE,

    END_OF_FILE
}

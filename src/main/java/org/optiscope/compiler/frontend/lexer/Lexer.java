package org.optiscope.compiler.frontend.lexer;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.model.SourceLocation;
import org.optiscope.compiler.model.Token;
import org.optiscope.compiler.model.TokenType;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into a list of tokens. Comments and whitespace are dropped.
 * Errors are reported to the diagnostics engine and the offending character is skipped,
 * so a single run reports every lexical problem.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("let", TokenType.LET),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("if", TokenType.IF),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("for", TokenType.FOR),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("leave", TokenType.LEAVE),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE)
    );

    private final String source;
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * @param source      The source text.
     * @param fileName    The logical name of the source, used in locations.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(String source, String fileName, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case ',' -> addToken(TokenType.COMMA);
            case ':' -> {
                if (match('=')) {
                    addToken(TokenType.ASSIGN);
                } else {
                    error("Expected '=' after ':'.");
                }
            }
            case '-' -> {
                if (match('>')) {
                    addToken(TokenType.ARROW);
                } else {
                    error("Unexpected character '-'.");
                }
            }
            case '/' -> {
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    error("Unexpected character '/'.");
                }
            }
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    error("Unexpected character '" + c + "'.");
                }
            }
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error("Unterminated comment.");
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        if ("hex".equals(text) && peek() == '"') {
            hexString();
            return;
        }
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        if (source.charAt(start) == '0' && (peek() == 'x') && isHexDigit(peekNext())) {
            advance();
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
        }
        if (isIdentifierPart(peek())) {
            while (isIdentifierPart(peek())) advance();
            error("Invalid number literal '" + source.substring(start, current) + "'.");
            return;
        }
        addToken(TokenType.NUMBER);
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                error("Unterminated string literal.");
                return;
            }
            if (c == '\\') {
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case '\\' -> value.append('\\');
                    case '"' -> value.append('"');
                    case '\'' -> value.append('\'');
                    case 'x' -> {
                        if (isHexDigit(peek()) && isHexDigit(peekNext())) {
                            String hex = "" + advance() + advance();
                            value.append((char) Integer.parseInt(hex, 16));
                        } else {
                            error("Invalid \\x escape in string literal.");
                        }
                    }
                    default -> error("Invalid escape sequence '\\" + escaped + "'.");
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            error("Unterminated string literal.");
            return;
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private void hexString() {
        advance(); // opening quote
        int contentStart = current;
        while (peek() != '"' && !isAtEnd()) {
            if (!isHexDigit(peek()) && peek() != '_') {
                error("Invalid character '" + peek() + "' in hex literal.");
            }
            advance();
        }
        if (isAtEnd()) {
            error("Unterminated hex literal.");
            return;
        }
        String digits = source.substring(contentStart, current).replace("_", "");
        advance(); // closing quote
        if (digits.length() % 2 != 0) {
            error("Hex literal must contain an even number of digits.");
            return;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            bytes.writeBytes(HexFormat.of().parseHex(digits));
        } catch (IllegalArgumentException e) {
            error("Malformed hex literal.");
            return;
        }
        addToken(TokenType.HEX_STRING, bytes.toByteArray());
    }

    private void error(String message) {
        diagnostics.reportError(message, new SourceLocation(fileName, startLine, startColumn));
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, fileName));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '.';
    }
}

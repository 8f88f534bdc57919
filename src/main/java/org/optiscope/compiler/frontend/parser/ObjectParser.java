package org.optiscope.compiler.frontend.parser;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.diagnostics.ParseException;
import org.optiscope.compiler.frontend.lexer.Lexer;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.model.Token;
import org.optiscope.compiler.model.TokenType;
import org.optiscope.compiler.object.DataNode;
import org.optiscope.compiler.object.IObjectEntry;
import org.optiscope.compiler.object.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Parses either a bare code block or object notation:
 * <pre>
 * object "Name" {
 *     code { ... }
 *     object "Sub" { ... }
 *     data "table" hex"0102"
 * }
 * </pre>
 */
public class ObjectParser {

    public static final String DEFAULT_OBJECT_NAME = "object";

    /**
     * Parses the given source.
     * @param source   The source text.
     * @param fileName The logical source name used in diagnostics.
     * @return The parsed root object.
     * @throws ParseException if the source is malformed.
     */
    public ParsedSource parse(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, fileName, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new ParseException("Could not tokenize source.", diagnostics.getDiagnostics());
        }

        ParsingContext parser = new Parser(tokens, diagnostics);
        ParsedSource result;
        if (parser.check(TokenType.LEFT_BRACE)) {
            Block code = parser.parseBlock();
            result = new ParsedSource(new ObjectNode(DEFAULT_OBJECT_NAME, code), true);
        } else {
            result = new ParsedSource(parseObject(parser), false);
        }
        if (!parser.isAtEnd()) {
            throw parser.error(parser.peek(),
                    "Unexpected content after the end of the input: '" + parser.peek().text() + "'.");
        }
        return result;
    }

    private ObjectNode parseObject(ParsingContext parser) {
        expectWord(parser, "object");
        Token name = parser.expect(TokenType.STRING, "Expected the object name as a string literal.");
        String objectName = checkName(parser, name);
        parser.expect(TokenType.LEFT_BRACE, "Expected '{' after the object name.");
        expectWord(parser, "code");
        ObjectNode object = new ObjectNode(objectName, parser.parseBlock());

        while (parser.check(TokenType.IDENTIFIER)) {
            Token word = parser.peek();
            if ("object".equals(word.text())) {
                addEntry(parser, object, parseObject(parser), word);
            } else if ("data".equals(word.text())) {
                parser.advance();
                Token dataName = parser.expect(TokenType.STRING, "Expected the data name as a string literal.");
                String entryName = checkName(parser, dataName);
                byte[] bytes;
                Optional<Token> hex = parser.accept(TokenType.HEX_STRING);
                if (hex.isPresent()) {
                    bytes = (byte[]) hex.get().value();
                } else {
                    Token text = parser.expect(TokenType.STRING, "Expected a string or hex literal as data.");
                    bytes = ((String) text.value()).getBytes(StandardCharsets.ISO_8859_1);
                }
                addEntry(parser, object, new DataNode(entryName, bytes), word);
            } else {
                break;
            }
        }
        parser.expect(TokenType.RIGHT_BRACE, "Expected 'object', 'data' or '}'.");
        return object;
    }

    private static void addEntry(ParsingContext parser, ObjectNode parent, IObjectEntry entry,
                                 Token at) {
        if (parent.findEntry(entry.name()).isPresent()) {
            throw parser.error(at,
                    "Object name '" + entry.name() + "' cannot be used twice in object '" + parent.name() + "'.");
        }
        parent.addEntry(entry);
    }

    private static String checkName(ParsingContext parser, Token name) {
        String value = (String) name.value();
        if (value.isEmpty() || value.contains(".")) {
            throw parser.error(name, "Object and data names must be non-empty and cannot contain '.'.");
        }
        return value;
    }

    private static void expectWord(ParsingContext parser, String word) {
        Token token = parser.peek();
        if (token.type() != TokenType.IDENTIFIER || !word.equals(token.text())) {
            throw parser.error(token, "Expected '" + word + "'.");
        }
        parser.advance();
    }
}

package org.optiscope.compiler.frontend.parser;

import org.optiscope.compiler.diagnostics.ParseException;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.model.Token;
import org.optiscope.compiler.model.TokenType;

import java.util.Optional;

/**
 * The token cursor the object parser walks. Object notation wraps code blocks, so both parsers
 * share one token stream and the object parser hands every {@code code { ... }} to
 * {@link #parseBlock()}.
 */
public interface ParsingContext {

    Token peek();

    boolean check(TokenType type);

    Token advance();

    /**
     * Consumes the current token if it has the given type.
     */
    Optional<Token> accept(TokenType type);

    /**
     * @throws ParseException if the current token has another type.
     */
    Token expect(TokenType type, String errorMessage);

    /**
     * Parses the braced code block at the current position.
     */
    Block parseBlock();

    /**
     * Records a syntax error at the token.
     * @return The exception to throw, carrying all diagnostics so far.
     */
    ParseException error(Token at, String message);

    boolean isAtEnd();
}

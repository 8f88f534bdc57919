package org.optiscope.compiler.frontend.parser;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.diagnostics.ParseException;
import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Continue;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.LiteralKind;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.model.Token;
import org.optiscope.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for code blocks. Parsing stops at the first syntax error: the error is
 * reported to the diagnostics engine and a {@link ParseException} carrying all diagnostics is thrown.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * @param tokens      The token stream, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting syntax errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a braced block at the current position.
     * @return The parsed block.
     * @throws ParseException on the first syntax error.
     */
    @Override
    public Block parseBlock() {
        Token open = expect(TokenType.LEFT_BRACE, "Expected '{'.");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        expect(TokenType.RIGHT_BRACE, "Expected '}' to close the block.");
        return new Block(statements, open.location());
    }

    private Statement statement() {
        Token token = peek();
        return switch (token.type()) {
            case LEFT_BRACE -> parseBlock();
            case LET -> variableDeclaration();
            case FUNCTION -> functionDefinition();
            case IF -> ifStatement();
            case SWITCH -> switchStatement();
            case FOR -> forLoop();
            case BREAK -> new Break(advance().location());
            case CONTINUE -> new Continue(advance().location());
            case LEAVE -> new Leave(advance().location());
            case IDENTIFIER -> callOrAssignment();
            default -> throw error(token, "Expected a statement but found '" + token.text() + "'.");
        };
    }

    private VariableDeclaration variableDeclaration() {
        Token let = advance();
        List<TypedName> names = typedNameList("Expected a variable name after 'let'.");
        Expression value = null;
        if (match(TokenType.ASSIGN)) {
            value = expression();
        }
        return new VariableDeclaration(names, value, let.location());
    }

    private FunctionDefinition functionDefinition() {
        Token keyword = advance();
        Token name = expect(TokenType.IDENTIFIER, "Expected a function name.");
        expect(TokenType.LEFT_PAREN, "Expected '(' after the function name.");
        List<TypedName> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            parameters = typedNameList("Expected a parameter name.");
        }
        expect(TokenType.RIGHT_PAREN, "Expected ')' after the parameters.");
        List<TypedName> returns = new ArrayList<>();
        if (match(TokenType.ARROW)) {
            returns = typedNameList("Expected a return variable name after '->'.");
        }
        Block body = parseBlock();
        return new FunctionDefinition(name.text(), parameters, returns, body, keyword.location());
    }

    private If ifStatement() {
        Token keyword = advance();
        Expression condition = expression();
        Block body = parseBlock();
        return new If(condition, body, keyword.location());
    }

    private Switch switchStatement() {
        Token keyword = advance();
        Expression expression = expression();
        List<Case> cases = new ArrayList<>();
        while (check(TokenType.CASE)) {
            Token caseToken = advance();
            Expression value = expression();
            if (!(value instanceof Literal literal)) {
                throw error(caseToken, "Literal expected after 'case'.");
            }
            cases.add(new Case(literal, parseBlock(), caseToken.location()));
        }
        if (check(TokenType.DEFAULT)) {
            Token defaultToken = advance();
            cases.add(new Case(null, parseBlock(), defaultToken.location()));
        }
        if (check(TokenType.CASE)) {
            throw error(peek(), "Case not allowed after the default case.");
        }
        return new Switch(expression, cases, keyword.location());
    }

    private ForLoop forLoop() {
        Token keyword = advance();
        Block pre = parseBlock();
        Expression condition = expression();
        Block post = parseBlock();
        Block body = parseBlock();
        return new ForLoop(pre, condition, post, body, keyword.location());
    }

    private Statement callOrAssignment() {
        Token first = peek();
        Expression expression = expression();
        if (expression instanceof FunctionCall) {
            if (check(TokenType.ASSIGN) || check(TokenType.COMMA)) {
                throw error(peek(), "Cannot assign to a function call.");
            }
            return new ExpressionStatement(expression, first.location());
        }
        if (!(expression instanceof Identifier identifier)) {
            throw error(first, "Call or assignment expected.");
        }
        List<Identifier> targets = new ArrayList<>();
        targets.add(identifier);
        while (match(TokenType.COMMA)) {
            Token name = expect(TokenType.IDENTIFIER, "Expected a variable name after ','.");
            targets.add(new Identifier(name.text(), name.location()));
        }
        expect(TokenType.ASSIGN, "Call or assignment expected.");
        Expression value = expression();
        return new Assignment(targets, value, first.location());
    }

    private Expression expression() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new Literal(LiteralKind.NUMBER, token.text(), token.location());
            }
            case STRING -> {
                advance();
                return new Literal(LiteralKind.STRING, (String) token.value(), token.location());
            }
            case TRUE, FALSE -> {
                advance();
                return new Literal(LiteralKind.BOOLEAN, token.text(), token.location());
            }
            case IDENTIFIER -> {
                advance();
                Identifier name = new Identifier(token.text(), token.location());
                if (!match(TokenType.LEFT_PAREN)) {
                    return name;
                }
                List<Expression> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(expression());
                    } while (match(TokenType.COMMA));
                }
                expect(TokenType.RIGHT_PAREN, "Expected ')' after the arguments.");
                return new FunctionCall(name, arguments, token.location());
            }
            default -> throw error(token, "Literal or identifier expected but found '" + token.text() + "'.");
        }
    }

    private List<TypedName> typedNameList(String errorMessage) {
        List<TypedName> names = new ArrayList<>();
        do {
            Token name = expect(TokenType.IDENTIFIER, errorMessage);
            names.add(new TypedName(name.text(), name.location()));
        } while (match(TokenType.COMMA));
        return names;
    }

    @Override
    public ParseException error(Token token, String message) {
        diagnostics.reportError(message, token.location());
        return new ParseException(message, diagnostics.getDiagnostics());
    }

    @Override
    public Optional<Token> accept(TokenType type) {
        return check(type) ? Optional.of(advance()) : Optional.empty();
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token expect(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}

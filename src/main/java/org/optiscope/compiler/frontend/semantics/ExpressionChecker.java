package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.dialect.BuiltinFunction;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.LiteralKind;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks expressions and computes how many values they yield. Identifiers are resolved in the
 * symbol table's current scope; references are recorded in the analysis info.
 */
public class ExpressionChecker {

    private final Dialect dialect;
    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final Set<String> dataNames;

    /**
     * @param dialect     The dialect providing builtin signatures.
     * @param symbolTable The symbol table used for resolution.
     * @param diagnostics The engine for reporting errors.
     * @param dataNames   The qualified object and data names that literal-argument builtins may refer to.
     */
    public ExpressionChecker(Dialect dialect, SymbolTable symbolTable, DiagnosticsEngine diagnostics,
                             Set<String> dataNames) {
        this.dialect = dialect;
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.dataNames = dataNames;
    }

    /**
     * Checks that the expression yields exactly one value.
     */
    public void expectSingleValue(Expression expression) {
        int count = check(expression);
        if (count != 1) {
            diagnostics.reportError("Expected expression to evaluate to one value, but got " + count
                    + " values instead.", expression.location());
        }
    }

    /**
     * Checks the expression.
     * @return The number of values it yields. Erroneous sub-expressions count as one value so that
     *         a single mistake is not reported repeatedly.
     */
    public int check(Expression expression) {
        if (expression instanceof Literal literal) {
            checkLiteral(literal);
            return 1;
        }
        if (expression instanceof Identifier identifier) {
            checkValueIdentifier(identifier);
            return 1;
        }
        if (expression instanceof FunctionCall call) {
            return checkCall(call);
        }
        throw new IllegalStateException("Unknown expression type: " + expression.getClass().getName());
    }

    public void checkLiteral(Literal literal) {
        if (literal.kind() == LiteralKind.NUMBER) {
            BigInteger value = literal.numericValue();
            if (value.bitLength() > 256) {
                diagnostics.reportError("Number literal too large (> 256 bits)", literal.location());
            }
        } else if (literal.kind() == LiteralKind.STRING) {
            int length = literal.value().getBytes(StandardCharsets.ISO_8859_1).length;
            if (length > 32) {
                diagnostics.reportError("String literal too long (" + length + " > 32)", literal.location());
            }
        }
    }

    private void checkValueIdentifier(Identifier identifier) {
        if (dialect.isBuiltin(identifier.name())) {
            diagnostics.reportError("Builtin function \"" + identifier.name() + "\" must be called.",
                    identifier.location());
            return;
        }
        Optional<Symbol> symbol = symbolTable.resolve(identifier);
        if (symbol.isEmpty()) {
            reportNotFound(identifier);
        } else if (symbol.get().isFunction()) {
            diagnostics.reportError("Function \"" + identifier.name() + "\" used without being called.",
                    identifier.location());
        }
    }

    private int checkCall(FunctionCall call) {
        Identifier name = call.functionName();
        List<Expression> arguments = call.arguments();
        Optional<BuiltinFunction> builtin = dialect.builtin(name.name());
        int parameters;
        int returns;
        boolean literalArguments = false;

        if (builtin.isPresent()) {
            parameters = builtin.get().parameters();
            returns = builtin.get().returns();
            literalArguments = builtin.get().literalArguments();
        } else {
            Optional<Symbol> symbol = symbolTable.resolve(name);
            if (symbol.isEmpty()) {
                diagnostics.reportError("Function \"" + name.name() + "\" not found.", name.location());
                checkArguments(arguments);
                return 1;
            }
            if (!symbol.get().isFunction()) {
                diagnostics.reportError("Attempt to call variable instead of function.", name.location());
                checkArguments(arguments);
                return 1;
            }
            parameters = symbol.get().parameters();
            returns = symbol.get().returns();
        }

        if (arguments.size() != parameters) {
            diagnostics.reportError("Function \"" + name.name() + "\" expects " + parameters
                    + " arguments but got " + arguments.size() + ".", call.location());
        }

        if (literalArguments) {
            for (Expression argument : arguments) {
                checkDataReference(name.name(), argument);
            }
        } else {
            checkArguments(arguments);
        }
        return returns;
    }

    private void checkArguments(List<Expression> arguments) {
        // evaluated right to left
        for (int i = arguments.size() - 1; i >= 0; i--) {
            expectSingleValue(arguments.get(i));
        }
    }

    private void checkDataReference(String function, Expression argument) {
        if (!(argument instanceof Literal literal) || literal.kind() != LiteralKind.STRING) {
            diagnostics.reportError("Function \"" + function + "\" expects a string literal naming an object or data.",
                    argument.location());
            return;
        }
        if (!dataNames.contains(literal.value())) {
            diagnostics.reportError("Unknown data object \"" + literal.value() + "\".", literal.location());
        }
    }

    private void reportNotFound(Identifier identifier) {
        diagnostics.reportError("Identifier \"" + identifier.name() + "\" not found.", identifier.location());
    }
}

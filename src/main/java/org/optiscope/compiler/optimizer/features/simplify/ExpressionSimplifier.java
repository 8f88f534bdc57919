package org.optiscope.compiler.optimizer.features.simplify;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.LiteralKind;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.SideEffects;
import org.optiscope.compiler.optimizer.StepContext;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds builtin calls on constant arguments and applies neutral-element rules such as
 * {@code add(x, 0) -> x}. Rules that drop an operand only fire if the dropped operand is movable.
 */
public class ExpressionSimplifier implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Dialect dialect = context.dialect();
        return new AstTransformer() {
            @Override
            public Expression transformExpression(Expression expression) {
                Expression rebuilt = super.transformExpression(expression);
                if (rebuilt instanceof FunctionCall call && dialect.isBuiltin(call.functionName().name())) {
                    return simplify(call, dialect);
                }
                return rebuilt;
            }
        }.transformBlock(code);
    }

    private Expression simplify(FunctionCall call, Dialect dialect) {
        if (dialect.builtin(call.functionName().name()).orElseThrow().parameters() != call.arguments().size()) {
            return call;
        }
        Optional<Expression> folded = fold(call);
        if (folded.isPresent()) {
            return folded.get();
        }
        String name = call.functionName().name();
        List<Expression> args = call.arguments();
        switch (name) {
            case "add", "or", "xor" -> {
                if (isConstant(args.get(1), 0)) return args.get(0);
                if (isConstant(args.get(0), 0)) return args.get(1);
            }
            case "sub" -> {
                if (isConstant(args.get(1), 0)) return args.get(0);
                if (sameVariable(args.get(0), args.get(1))) return zero(call);
            }
            case "mul" -> {
                if (isConstant(args.get(1), 1)) return args.get(0);
                if (isConstant(args.get(0), 1)) return args.get(1);
                if (isConstant(args.get(1), 0) && SideEffects.isMovable(args.get(0), dialect)) return zero(call);
                if (isConstant(args.get(0), 0) && SideEffects.isMovable(args.get(1), dialect)) return zero(call);
            }
            case "div", "sdiv" -> {
                if (isConstant(args.get(1), 1)) return args.get(0);
            }
            case "and" -> {
                if (isConstant(args.get(1), 0) && SideEffects.isMovable(args.get(0), dialect)) return zero(call);
                if (isConstant(args.get(0), 0) && SideEffects.isMovable(args.get(1), dialect)) return zero(call);
                if (sameVariable(args.get(0), args.get(1))) return args.get(0);
            }
            case "shl", "shr", "sar" -> {
                if (isConstant(args.get(0), 0)) return args.get(1);
            }
            case "eq" -> {
                if (sameVariable(args.get(0), args.get(1))) return Literal.number(1, call.location());
            }
            case "iszero" -> {
                // iszero(iszero(iszero(x))) -> iszero(x)
                if (args.get(0) instanceof FunctionCall inner && isCallOf(inner, "iszero")
                        && inner.arguments().get(0) instanceof FunctionCall innermost && isCallOf(innermost, "iszero")) {
                    return innermost;
                }
            }
            default -> { }
        }
        return call;
    }

    private static Optional<Expression> fold(FunctionCall call) {
        List<BigInteger> values = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            if (!(argument instanceof Literal literal) || literal.kind() == LiteralKind.STRING) {
                return Optional.empty();
            }
            values.add(literal.numericValue());
        }
        return EvmArithmetic.evaluate(call.functionName().name(), values)
                .map(value -> Literal.number(value, call.location()));
    }

    private static boolean isConstant(Expression expression, long value) {
        return expression instanceof Literal literal && literal.kind() != LiteralKind.STRING
                && literal.numericValue().equals(BigInteger.valueOf(value));
    }

    private static boolean sameVariable(Expression a, Expression b) {
        return a instanceof Identifier x && b instanceof Identifier y && x.name().equals(y.name());
    }

    private static boolean isCallOf(FunctionCall call, String name) {
        return call.functionName().name().equals(name);
    }

    private static Literal zero(FunctionCall call) {
        return Literal.number(0, call.location());
    }
}

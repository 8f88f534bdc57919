package org.optiscope.compiler.optimizer.features.split;

import org.optiscope.compiler.dialect.BuiltinFunction;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.NameDispenser;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves every call argument that is not an identifier into a fresh variable declared right
 * before the statement, so that each statement performs at most one call:
 * <pre>
 * mstore(add(x, 1), 0x20)
 * </pre>
 * becomes
 * <pre>
 * let _1 := 0x20
 * let _2 := 1
 * let _3 := add(x, _2)
 * mstore(_3, _1)
 * </pre>
 * Arguments are outlined from right to left to keep the evaluation order. The conditions of
 * {@code if} and {@code switch} are outlined as a whole; loop conditions are left alone.
 */
public class ExpressionSplitter implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        return new Splitter(context.dialect(), context.nameDispenser()).transformBlock(code);
    }

    private static final class Splitter extends AstTransformer {

        private final Dialect dialect;
        private final NameDispenser names;
        private List<Statement> prefix = new ArrayList<>();

        Splitter(Dialect dialect, NameDispenser names) {
            this.dialect = dialect;
            this.names = names;
        }

        @Override
        protected List<Statement> transformStatement(Statement statement) {
            List<Statement> outer = prefix;
            prefix = new ArrayList<>();
            Statement rebuilt = split(statement);
            List<Statement> result = new ArrayList<>(prefix);
            result.add(rebuilt);
            prefix = outer;
            return result;
        }

        private Statement split(Statement statement) {
            if (statement instanceof ExpressionStatement s) {
                return new ExpressionStatement(splitArguments(s.expression()), s.location());
            }
            if (statement instanceof VariableDeclaration d && d.value() != null) {
                List<TypedName> variables = transformNames(d.variables());
                return new VariableDeclaration(variables, splitArguments(d.value()), d.location());
            }
            if (statement instanceof Assignment a) {
                List<Identifier> targets = new ArrayList<>();
                for (Identifier target : a.variableNames()) {
                    targets.add(transformIdentifier(target));
                }
                return new Assignment(targets, splitArguments(a.value()), a.location());
            }
            if (statement instanceof If i) {
                Expression condition = outline(i.condition());
                return new If(condition, transformBlock(i.body()), i.location());
            }
            if (statement instanceof Switch s) {
                Expression expression = outline(s.expression());
                Switch rest = (Switch) rebuild(s);
                return new Switch(expression, rest.cases(), s.location());
            }
            return rebuild(statement);
        }

        /**
         * Outlines the arguments of a call and keeps the call itself in place.
         */
        private Expression splitArguments(Expression expression) {
            if (!(expression instanceof FunctionCall call) || hasLiteralArguments(call)) {
                return transformExpression(expression);
            }
            int count = call.arguments().size();
            Expression[] arguments = new Expression[count];
            for (int i = count - 1; i >= 0; i--) {
                arguments[i] = outline(call.arguments().get(i));
            }
            return new FunctionCall(transformCallee(call.functionName()), List.of(arguments), call.location());
        }

        /**
         * Replaces the expression by a reference to a new variable holding its value.
         */
        private Expression outline(Expression expression) {
            if (expression instanceof Identifier identifier) {
                return transformIdentifier(identifier);
            }
            Expression value = splitArguments(expression);
            String name = names.newName("");
            prefix.add(new VariableDeclaration(List.of(new TypedName(name, expression.location())), value,
                    expression.location()));
            return new Identifier(name, expression.location());
        }

        private boolean hasLiteralArguments(FunctionCall call) {
            return dialect.builtin(call.functionName().name()).map(BuiltinFunction::literalArguments).orElse(false);
        }
    }
}

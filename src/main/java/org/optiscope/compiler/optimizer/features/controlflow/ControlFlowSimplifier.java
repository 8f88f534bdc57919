package org.optiscope.compiler.optimizer.features.controlflow;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.LiteralKind;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.model.SourceLocation;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.SideEffects;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simplifies control flow with constant or trivial structure:
 * <ul>
 *   <li>{@code if} with a constant condition becomes its body or disappears,</li>
 *   <li>{@code if} with an empty body keeps only the condition's side effects,</li>
 *   <li>{@code switch} on a constant selects the matching case,</li>
 *   <li>{@code switch} with a single case becomes an {@code if}, with only a default its body,</li>
 *   <li>{@code for} with a constant zero condition keeps only its init block.</li>
 * </ul>
 */
public class ControlFlowSimplifier implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Dialect dialect = context.dialect();
        return new AstTransformer() {
            @Override
            protected List<Statement> transformStatement(Statement statement) {
                Statement rebuilt = rebuild(statement);
                if (rebuilt instanceof If ifStatement) {
                    return simplifyIf(ifStatement, dialect);
                }
                if (rebuilt instanceof Switch switchStatement) {
                    return simplifySwitch(switchStatement, dialect);
                }
                if (rebuilt instanceof ForLoop loop && isConstant(loop.condition())
                        && ((Literal) loop.condition()).isZero()) {
                    return List.of(loop.pre());
                }
                return List.of(rebuilt);
            }
        }.transformBlock(code);
    }

    private static List<Statement> simplifyIf(If ifStatement, Dialect dialect) {
        if (isConstant(ifStatement.condition())) {
            return ((Literal) ifStatement.condition()).isZero() ? List.of() : List.of(ifStatement.body());
        }
        if (ifStatement.body().isEmpty()) {
            return discard(ifStatement.condition(), dialect, ifStatement.location());
        }
        return List.of(ifStatement);
    }

    private static List<Statement> simplifySwitch(Switch switchStatement, Dialect dialect) {
        List<Case> cases = switchStatement.cases();
        Expression expression = switchStatement.expression();
        if (isConstant(expression)) {
            Optional<Case> matching = cases.stream()
                    .filter(c -> !c.isDefault()
                            && c.value().numericValue().equals(((Literal) expression).numericValue()))
                    .findFirst();
            if (matching.isEmpty()) {
                matching = cases.stream().filter(Case::isDefault).findFirst();
            }
            return matching.<List<Statement>>map(c -> List.of(c.body())).orElse(List.of());
        }
        if (cases.size() == 1) {
            Case only = cases.get(0);
            if (only.isDefault()) {
                List<Statement> result = new ArrayList<>(discard(expression, dialect, switchStatement.location()));
                result.add(only.body());
                return result;
            }
            FunctionCall condition = FunctionCall.of("eq", switchStatement.location(), only.value(), expression);
            return List.of(new If(condition, only.body(), switchStatement.location()));
        }
        return List.of(switchStatement);
    }

    /**
     * Evaluates an expression only for its side effects.
     */
    private static List<Statement> discard(Expression expression, Dialect dialect, SourceLocation location) {
        if (SideEffects.isSideEffectFree(expression, dialect)) {
            return List.of();
        }
        return List.of(new ExpressionStatement(FunctionCall.of("pop", location, expression), location));
    }

    private static boolean isConstant(Expression expression) {
        return expression instanceof Literal literal && literal.kind() != LiteralKind.STRING;
    }
}

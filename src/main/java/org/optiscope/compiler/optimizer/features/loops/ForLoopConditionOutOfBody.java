package org.optiscope.compiler.optimizer.features.loops;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.LiteralKind;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.List;

/**
 * Reverses {@link ForLoopConditionIntoBody}: a loop with a constant true condition whose body starts
 * with {@code if c { break }} gets {@code iszero(c)} as its condition, and {@code if iszero(c) { break }}
 * gets {@code c}.
 */
public class ForLoopConditionOutOfBody implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        return new AstTransformer() {
            @Override
            protected Statement transformForLoop(ForLoop loop) {
                ForLoop rebuilt = (ForLoop) super.transformForLoop(loop);
                if (!isConstantTrue(rebuilt.condition()) || rebuilt.body().isEmpty()) {
                    return rebuilt;
                }
                List<Statement> body = rebuilt.body().statements();
                if (!(body.get(0) instanceof If guard) || !isSingleBreak(guard.body())) {
                    return rebuilt;
                }
                Expression condition;
                if (guard.condition() instanceof FunctionCall call && call.functionName().name().equals("iszero")) {
                    condition = call.arguments().get(0);
                } else {
                    condition = FunctionCall.of("iszero", guard.location(), guard.condition());
                }
                return new ForLoop(rebuilt.pre(), condition, rebuilt.post(),
                        new Block(body.subList(1, body.size()), rebuilt.body().location()), rebuilt.location());
            }
        }.transformBlock(code);
    }

    private static boolean isConstantTrue(Expression expression) {
        return expression instanceof Literal literal && literal.kind() != LiteralKind.STRING && !literal.isZero();
    }

    private static boolean isSingleBreak(Block block) {
        return block.statements().size() == 1 && block.statements().get(0) instanceof Break;
    }
}

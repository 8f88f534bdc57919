package org.optiscope.compiler.optimizer.features.loops;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.model.SourceLocation;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves non-constant loop conditions into the loop body:
 * {@code for { } c { } { body }} becomes {@code for { } 1 { } { if iszero(c) { break } body }}.
 */
public class ForLoopConditionIntoBody implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        return new AstTransformer() {
            @Override
            protected Statement transformForLoop(ForLoop loop) {
                ForLoop rebuilt = (ForLoop) super.transformForLoop(loop);
                if (rebuilt.condition() instanceof Literal) {
                    return rebuilt;
                }
                SourceLocation location = rebuilt.condition().location();
                Block breakBlock = new Block(List.of(new Break(location)), location);
                List<Statement> body = new ArrayList<>();
                body.add(new If(FunctionCall.of("iszero", location, rebuilt.condition()), breakBlock, location));
                body.addAll(rebuilt.body().statements());
                return new ForLoop(rebuilt.pre(), Literal.number(1, location), rebuilt.post(),
                        new Block(body, rebuilt.body().location()), rebuilt.location());
            }
        }.transformBlock(code);
    }
}

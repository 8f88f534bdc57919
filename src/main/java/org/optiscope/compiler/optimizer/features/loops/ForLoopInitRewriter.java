package org.optiscope.compiler.optimizer.features.loops;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the init statements of every loop into a new block enclosing the loop:
 * {@code for { let i := 0 } lt(i, 3) { ... } { ... }} becomes
 * {@code { let i := 0 for { } lt(i, 3) { ... } { ... } }}.
 */
public class ForLoopInitRewriter implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        return new AstTransformer() {
            @Override
            protected Statement transformForLoop(ForLoop loop) {
                ForLoop rebuilt = (ForLoop) super.transformForLoop(loop);
                if (rebuilt.pre().isEmpty()) {
                    return rebuilt;
                }
                List<Statement> statements = new ArrayList<>(rebuilt.pre().statements());
                statements.add(new ForLoop(Block.empty(rebuilt.pre().location()), rebuilt.condition(),
                        rebuilt.post(), rebuilt.body(), rebuilt.location()));
                return new Block(statements, loop.location());
            }
        }.transformBlock(code);
    }
}

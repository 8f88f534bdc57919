package org.optiscope.compiler.optimizer.features.flatten;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;
import org.optiscope.compiler.optimizer.features.group.FunctionGrouper;

import java.util.ArrayList;
import java.util.List;

/**
 * Splices nested bare blocks into their parent block. A grouped top level keeps its shape:
 * only the contents of the main block and the function bodies are flattened.
 */
public class BlockFlattener implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Flattener flattener = new Flattener();
        if (!FunctionGrouper.isGrouped(code)) {
            return flattener.transformBlock(code);
        }
        List<Statement> statements = new ArrayList<>();
        for (Statement statement : code.statements()) {
            statements.add(flattener.rebuild(statement));
        }
        return new Block(statements, code.location());
    }

    private static final class Flattener extends AstTransformer {

        @Override
        public Block transformBlock(Block block) {
            List<Statement> statements = new ArrayList<>();
            for (Statement statement : block.statements()) {
                Statement rebuilt = rebuild(statement);
                if (rebuilt instanceof Block nested) {
                    statements.addAll(nested.statements());
                } else {
                    statements.add(rebuilt);
                }
            }
            return new Block(statements, block.location());
        }
    }
}

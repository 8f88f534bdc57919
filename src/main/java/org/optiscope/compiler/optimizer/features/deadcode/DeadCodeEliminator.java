package org.optiscope.compiler.optimizer.features.deadcode;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Continue;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.SideEffects;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes unreachable statements following {@code break}, {@code continue}, {@code leave} or a
 * call of a terminating builtin. Function definitions are kept since they are not executed in place.
 */
public class DeadCodeEliminator implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Dialect dialect = context.dialect();
        return new AstTransformer() {
            @Override
            public Block transformBlock(Block block) {
                List<Statement> statements = new ArrayList<>();
                boolean reachable = true;
                for (Statement statement : block.statements()) {
                    if (reachable || statement instanceof FunctionDefinition) {
                        statements.add(rebuild(statement));
                    }
                    if (reachable && terminates(statement, dialect)) {
                        reachable = false;
                    }
                }
                return new Block(statements, block.location());
            }
        }.transformBlock(code);
    }

    private static boolean terminates(Statement statement, Dialect dialect) {
        if (statement instanceof Break || statement instanceof Continue || statement instanceof Leave) {
            return true;
        }
        return statement instanceof ExpressionStatement s && SideEffects.isTerminatingCall(s.expression(), dialect);
    }
}

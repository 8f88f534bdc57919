package org.optiscope.compiler.optimizer.features.hoist;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves every function definition, nested ones included, to the end of the top-level block.
 * Inner functions end up before the function that contained them.
 */
public class FunctionHoister implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Hoister hoister = new Hoister();
        Block remaining = hoister.transformBlock(code);
        List<Statement> statements = new ArrayList<>(remaining.statements());
        statements.addAll(hoister.functions);
        return new Block(statements, code.location());
    }

    private static final class Hoister extends AstTransformer {

        private final List<FunctionDefinition> functions = new ArrayList<>();

        @Override
        protected List<Statement> transformStatement(Statement statement) {
            if (statement instanceof FunctionDefinition function) {
                functions.add(function.withBody(transformBlock(function.body())));
                return List.of();
            }
            return super.transformStatement(statement);
        }
    }
}

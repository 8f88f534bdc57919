package org.optiscope.compiler.optimizer.features.group;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings the top-level block into grouped form: a first block holding all code that is not a
 * function definition, followed by the top-level function definitions.
 */
public class FunctionGrouper implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        if (isGrouped(code)) {
            return code;
        }
        List<Statement> main = new ArrayList<>();
        List<Statement> functions = new ArrayList<>();
        for (Statement statement : code.statements()) {
            if (statement instanceof FunctionDefinition) {
                functions.add(statement);
            } else {
                main.add(statement);
            }
        }
        List<Statement> grouped = new ArrayList<>();
        grouped.add(new Block(main, code.location()));
        grouped.addAll(functions);
        return new Block(grouped, code.location());
    }

    /**
     * @return True if the first statement is a block and all others are function definitions.
     */
    public static boolean isGrouped(Block code) {
        List<Statement> statements = code.statements();
        if (statements.isEmpty() || !(statements.get(0) instanceof Block)) {
            return false;
        }
        return statements.stream().skip(1).allMatch(s -> s instanceof FunctionDefinition);
    }
}

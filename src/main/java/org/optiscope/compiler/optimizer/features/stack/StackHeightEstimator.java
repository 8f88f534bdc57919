package org.optiscope.compiler.optimizer.features.stack;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimates the stack height of every region as the maximum number of variables that are
 * in scope at the same time. A function region starts with its parameters and return variables.
 */
public final class StackHeightEstimator {

    /** Region key of the code outside of all functions. */
    public static final String TOP_LEVEL = "";

    private final Map<String, Integer> heights = new LinkedHashMap<>();

    private StackHeightEstimator() {}

    /**
     * @return The estimated height per region, keyed by function name or {@link #TOP_LEVEL}.
     */
    public static Map<String, Integer> estimate(Block code) {
        StackHeightEstimator estimator = new StackHeightEstimator();
        estimator.heights.put(TOP_LEVEL, 0);
        estimator.block(code, TOP_LEVEL, 0);
        return estimator.heights;
    }

    private int block(Block block, String region, int live) {
        int current = live;
        record(region, current);
        for (Statement statement : block.statements()) {
            current = statement(statement, region, current);
        }
        return current;
    }

    /**
     * @return The number of live variables after the statement.
     */
    private int statement(Statement statement, String region, int live) {
        if (statement instanceof VariableDeclaration declaration) {
            int after = live + declaration.variables().size();
            record(region, after);
            return after;
        }
        if (statement instanceof Block nested) {
            block(nested, region, live);
        } else if (statement instanceof If ifStatement) {
            block(ifStatement.body(), region, live);
        } else if (statement instanceof Switch switchStatement) {
            for (Case switchCase : switchStatement.cases()) {
                block(switchCase.body(), region, live);
            }
        } else if (statement instanceof ForLoop loop) {
            int inLoop = block(loop.pre(), region, live);
            block(loop.post(), region, inLoop);
            block(loop.body(), region, inLoop);
        } else if (statement instanceof FunctionDefinition function) {
            int arguments = function.parameters().size() + function.returnVariables().size();
            heights.put(function.name(), arguments);
            block(function.body(), function.name(), arguments);
        }
        return live;
    }

    private void record(String region, int height) {
        heights.merge(region, height, Math::max);
    }
}

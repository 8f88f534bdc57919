package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.Block;

/**
 * A transformation of one object's code.
 */
@FunctionalInterface
public interface IOptimiserStep {

    /**
     * Transforms the code block.
     * @param context The step context.
     * @param code    The code block of one object.
     * @return The transformed block. May be the same instance if nothing changed.
     */
    Block run(StepContext context, Block code);
}

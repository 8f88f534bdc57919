package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Expression;

/**
 * Deep copies code. Analysis info is keyed by node identity, so a node that should appear at
 * a second position in a tree must be copied first.
 */
public final class AstCopier {

    private static final AstTransformer COPIER = new AstTransformer();

    private AstCopier() {}

    public static Expression copy(Expression expression) {
        return COPIER.transformExpression(expression);
    }

    public static Block copy(Block block) {
        return COPIER.transformBlock(block);
    }
}

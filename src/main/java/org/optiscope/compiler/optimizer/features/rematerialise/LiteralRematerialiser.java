package org.optiscope.compiler.optimizer.features.rematerialise;

import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.optimizer.AstScanner;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.ReferenceCounter;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Replaces references to variables that are bound to a literal and never reassigned by the
 * literal itself. The declarations stay; the unused pruner removes them.
 */
public class LiteralRematerialiser implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        ReferenceCounter references = ReferenceCounter.count(code);
        Map<String, Literal> constants = new HashMap<>();
        new AstScanner() {
            @Override
            public void scan(AstNode node) {
                if (node instanceof VariableDeclaration declaration && declaration.variables().size() == 1
                        && declaration.value() instanceof Literal literal) {
                    TypedName variable = declaration.variables().get(0);
                    if (!references.isAssigned(variable.name())) {
                        constants.put(variable.name(), literal);
                    }
                }
                super.scan(node);
            }
        }.scan(code);

        return new AstTransformer() {
            @Override
            protected Expression transformIdentifierExpression(Identifier identifier) {
                Literal literal = constants.get(identifier.name());
                if (literal == null) {
                    return super.transformIdentifierExpression(identifier);
                }
                return new Literal(literal.kind(), literal.value(), identifier.location());
            }
        }.transformBlock(code);
    }
}

package org.optiscope.compiler.optimizer.features.prune;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.ReferenceCounter;
import org.optiscope.compiler.optimizer.SideEffects;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.List;

/**
 * Removes functions that are never called, declarations whose variables are never referenced
 * and expression statements without side effects. An unused single variable bound to an
 * expression with side effects is replaced by {@code pop(value)}.
 * <p>
 * Removing one declaration can make others unused, so the step repeats until nothing changes.
 */
public class UnusedPruner implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        Block current = code;
        while (true) {
            Pruner pruner = new Pruner(context.dialect(), ReferenceCounter.count(current));
            Block pruned = pruner.transformBlock(current);
            if (!pruner.changed) {
                return pruned;
            }
            current = pruned;
        }
    }

    private static final class Pruner extends AstTransformer {

        private final Dialect dialect;
        private final ReferenceCounter references;
        private boolean changed = false;

        Pruner(Dialect dialect, ReferenceCounter references) {
            this.dialect = dialect;
            this.references = references;
        }

        @Override
        protected List<Statement> transformStatement(Statement statement) {
            if (statement instanceof FunctionDefinition function && references.references(function.name()) == 0) {
                changed = true;
                return List.of();
            }
            if (statement instanceof VariableDeclaration declaration && allUnused(declaration)) {
                if (declaration.value() == null || SideEffects.isSideEffectFree(declaration.value(), dialect)) {
                    changed = true;
                    return List.of();
                }
                if (declaration.variables().size() == 1) {
                    changed = true;
                    FunctionCall pop = new FunctionCall(
                            new Identifier("pop", declaration.location()),
                            List.of(transformExpression(declaration.value())), declaration.location());
                    return List.of(new ExpressionStatement(pop, declaration.location()));
                }
            }
            if (statement instanceof ExpressionStatement s && SideEffects.isSideEffectFree(s.expression(), dialect)) {
                changed = true;
                return List.of();
            }
            return super.transformStatement(statement);
        }

        private boolean allUnused(VariableDeclaration declaration) {
            for (TypedName variable : declaration.variables()) {
                if (references.references(variable.name()) > 0) {
                    return false;
                }
            }
            return true;
        }
    }
}

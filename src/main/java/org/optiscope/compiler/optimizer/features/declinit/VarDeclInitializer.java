package org.optiscope.compiler.optimizer.features.declinit;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.IOptimiserStep;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Gives every declaration without a value an explicit zero: {@code let a, b} becomes
 * {@code let a := 0 let b := 0}.
 */
public class VarDeclInitializer implements IOptimiserStep {

    @Override
    public Block run(StepContext context, Block code) {
        return new AstTransformer() {
            @Override
            protected List<Statement> transformStatement(Statement statement) {
                if (statement instanceof VariableDeclaration declaration && declaration.value() == null) {
                    List<Statement> result = new ArrayList<>();
                    for (TypedName variable : declaration.variables()) {
                        result.add(new VariableDeclaration(
                                List.of(new TypedName(variable.name(), variable.location())),
                                Literal.number(0, declaration.location()),
                                declaration.location()));
                    }
                    return result;
                }
                return super.transformStatement(statement);
            }
        }.transformBlock(code);
    }
}

package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Continue;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for steps that rebuild a code block. Every method returns a rebuilt copy of its
 * input; subclasses override the hooks for the nodes they change.
 * <p>
 * {@link #transformStatement(Statement)} returns a list so that a statement can be removed
 * (empty list) or expanded into several statements.
 */
public class AstTransformer {

    public Block transformBlock(Block block) {
        List<Statement> statements = new ArrayList<>();
        for (Statement statement : block.statements()) {
            statements.addAll(transformStatement(statement));
        }
        return new Block(statements, block.location());
    }

    protected List<Statement> transformStatement(Statement statement) {
        return List.of(rebuild(statement));
    }

    /**
     * Rebuilds the statement with transformed children.
     */
    public Statement rebuild(Statement statement) {
        if (statement instanceof Block block) {
            return transformBlock(block);
        }
        if (statement instanceof ExpressionStatement s) {
            return new ExpressionStatement(transformExpression(s.expression()), s.location());
        }
        if (statement instanceof VariableDeclaration d) {
            Expression value = d.value() == null ? null : transformExpression(d.value());
            return new VariableDeclaration(transformNames(d.variables()), value, d.location());
        }
        if (statement instanceof Assignment a) {
            List<Identifier> targets = new ArrayList<>();
            for (Identifier target : a.variableNames()) {
                targets.add(transformIdentifier(target));
            }
            return new Assignment(targets, transformExpression(a.value()), a.location());
        }
        if (statement instanceof If i) {
            return new If(transformExpression(i.condition()), transformBlock(i.body()), i.location());
        }
        if (statement instanceof Switch s) {
            Expression expression = transformExpression(s.expression());
            List<Case> cases = new ArrayList<>();
            for (Case c : s.cases()) {
                Literal value = c.value() == null ? null : transformLiteral(c.value());
                cases.add(new Case(value, transformBlock(c.body()), c.location()));
            }
            return new Switch(expression, cases, s.location());
        }
        if (statement instanceof ForLoop loop) {
            return transformForLoop(loop);
        }
        if (statement instanceof FunctionDefinition f) {
            return transformFunction(f);
        }
        if (statement instanceof Break b) {
            return new Break(b.location());
        }
        if (statement instanceof Continue c) {
            return new Continue(c.location());
        }
        if (statement instanceof Leave l) {
            return new Leave(l.location());
        }
        throw new IllegalArgumentException("Unknown statement type: " + statement.getClass().getName());
    }

    protected Statement transformForLoop(ForLoop loop) {
        Block pre = transformBlock(loop.pre());
        Expression condition = transformExpression(loop.condition());
        Block post = transformBlock(loop.post());
        Block body = transformBlock(loop.body());
        return new ForLoop(pre, condition, post, body, loop.location());
    }

    protected Statement transformFunction(FunctionDefinition function) {
        return new FunctionDefinition(transformFunctionName(function), transformNames(function.parameters()),
                transformNames(function.returnVariables()), transformBlock(function.body()), function.location());
    }

    protected String transformFunctionName(FunctionDefinition function) {
        return function.name();
    }

    public Expression transformExpression(Expression expression) {
        if (expression instanceof FunctionCall call) {
            List<Expression> arguments = new ArrayList<>();
            for (Expression argument : call.arguments()) {
                arguments.add(transformExpression(argument));
            }
            return new FunctionCall(transformCallee(call.functionName()), arguments, call.location());
        }
        if (expression instanceof Identifier identifier) {
            return transformIdentifierExpression(identifier);
        }
        if (expression instanceof Literal literal) {
            return transformLiteral(literal);
        }
        throw new IllegalArgumentException("Unknown expression type: " + expression.getClass().getName());
    }

    /**
     * Hook for identifiers in value position. May replace the identifier by another expression.
     */
    protected Expression transformIdentifierExpression(Identifier identifier) {
        return transformIdentifier(identifier);
    }

    /**
     * Hook for variable references, both in value position and as assignment targets.
     */
    protected Identifier transformIdentifier(Identifier identifier) {
        return new Identifier(identifier.name(), identifier.location());
    }

    protected Identifier transformCallee(Identifier callee) {
        return new Identifier(callee.name(), callee.location());
    }

    protected Literal transformLiteral(Literal literal) {
        return new Literal(literal.kind(), literal.value(), literal.location());
    }

    protected List<TypedName> transformNames(List<TypedName> names) {
        List<TypedName> result = new ArrayList<>();
        for (TypedName name : names) {
            result.add(transformName(name));
        }
        return result;
    }

    protected TypedName transformName(TypedName name) {
        return new TypedName(name.name(), name.location());
    }
}

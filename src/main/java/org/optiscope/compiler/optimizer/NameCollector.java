package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.TypedName;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects every identifier spelled in a piece of code: declared variables, functions,
 * references and callees, builtins included.
 */
public final class NameCollector extends AstScanner {

    private final Set<String> names = new LinkedHashSet<>();

    public static Set<String> collect(AstNode node) {
        NameCollector collector = new NameCollector();
        collector.scan(node);
        return collector.names;
    }

    @Override
    protected void visitCall(FunctionCall call) {
        names.add(call.functionName().name());
    }

    @Override
    protected void visitIdentifier(Identifier identifier) {
        names.add(identifier.name());
    }

    @Override
    protected void visitDeclaration(TypedName name) {
        names.add(name.name());
    }

    @Override
    protected void visitFunction(FunctionDefinition function) {
        names.add(function.name());
    }
}

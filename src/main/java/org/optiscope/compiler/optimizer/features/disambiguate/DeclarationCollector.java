package org.optiscope.compiler.optimizer.features.disambiguate;

import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.optimizer.AstScanner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Lists declared names in order of appearance, duplicates included.
 */
public final class DeclarationCollector extends AstScanner {

    private final List<String> declared = new ArrayList<>();

    public static List<String> collect(AstNode... nodes) {
        DeclarationCollector collector = new DeclarationCollector();
        for (AstNode node : nodes) {
            collector.scan(node);
        }
        return collector.declared;
    }

    /**
     * Checks whether every declaration in the given code has a name no other declaration has.
     */
    public static boolean hasUniqueDeclarations(AstNode... nodes) {
        List<String> names = collect(nodes);
        return new HashSet<>(names).size() == names.size();
    }

    @Override
    protected void visitDeclaration(TypedName name) {
        declared.add(name.name());
    }

    @Override
    protected void visitFunction(FunctionDefinition function) {
        declared.add(function.name());
    }
}

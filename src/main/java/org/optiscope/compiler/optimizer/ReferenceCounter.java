package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Counts how often each name is referenced: as a value, as an assignment target or as the
 * callee of a function call. Counting by name is only meaningful on code with unique names.
 */
public final class ReferenceCounter extends AstScanner {

    private final Map<String, Integer> references = new HashMap<>();
    private final Set<String> assigned = new HashSet<>();

    public static ReferenceCounter count(AstNode node) {
        ReferenceCounter counter = new ReferenceCounter();
        counter.scan(node);
        return counter;
    }

    public int references(String name) {
        return references.getOrDefault(name, 0);
    }

    /**
     * @return True if the name is the target of at least one assignment.
     */
    public boolean isAssigned(String name) {
        return assigned.contains(name);
    }

    @Override
    protected void visitCall(FunctionCall call) {
        references.merge(call.functionName().name(), 1, Integer::sum);
    }

    @Override
    protected void visitIdentifier(Identifier identifier) {
        references.merge(identifier.name(), 1, Integer::sum);
    }

    @Override
    protected void visitAssignment(Assignment assignment) {
        for (Identifier target : assignment.variableNames()) {
            assigned.add(target.name());
        }
    }
}

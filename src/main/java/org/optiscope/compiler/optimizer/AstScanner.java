package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.TypedName;

/**
 * Read-only pre-order traversal over a code block. Subclasses override the callbacks they need.
 */
public abstract class AstScanner {

    public void scan(AstNode node) {
        if (node instanceof FunctionCall call) {
            visitCall(call);
            // arguments only, the callee is reported through visitCall
            for (AstNode argument : call.arguments()) {
                scan(argument);
            }
            return;
        }
        if (node instanceof Identifier identifier) {
            visitIdentifier(identifier);
        } else if (node instanceof TypedName name) {
            visitDeclaration(name);
        } else if (node instanceof FunctionDefinition function) {
            visitFunction(function);
        } else if (node instanceof Assignment assignment) {
            visitAssignment(assignment);
        }
        for (AstNode child : node.getChildren()) {
            scan(child);
        }
    }

    protected void visitCall(FunctionCall call) {}

    /**
     * Called for identifiers in value position and as assignment targets.
     */
    protected void visitIdentifier(Identifier identifier) {}

    protected void visitDeclaration(TypedName name) {}

    protected void visitFunction(FunctionDefinition function) {}

    protected void visitAssignment(Assignment assignment) {}
}

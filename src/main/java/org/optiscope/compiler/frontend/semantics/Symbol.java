package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.frontend.parser.ast.AstNode;

/**
 * A declared variable or function.
 * <p>
 * Symbols are compared by identity wherever they are used as map keys: two declarations with the
 * same name in sibling scopes are distinct symbols.
 *
 * @param name        The declared name.
 * @param type        Variable or function.
 * @param declaration The declaring node: a {@code TypedName} for variables, a {@code FunctionDefinition} for functions.
 * @param parameters  Number of parameters (functions only).
 * @param returns     Number of return values (functions only).
 */
public record Symbol(String name, Type type, AstNode declaration, int parameters, int returns) {

    public enum Type {
        VARIABLE,
        FUNCTION
    }

    public static Symbol variable(String name, AstNode declaration) {
        return new Symbol(name, Type.VARIABLE, declaration, 0, 1);
    }

    public boolean isFunction() {
        return type == Type.FUNCTION;
    }
}

package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.dialect.BuiltinFunction;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;

import java.util.Optional;

/**
 * Side-effect classification of expressions. Calls of user-defined functions are never
 * movable or side-effect free.
 */
public final class SideEffects {

    private SideEffects() {}

    /**
     * @return True if the expression can be moved, duplicated or removed freely.
     */
    public static boolean isMovable(Expression expression, Dialect dialect) {
        if (!(expression instanceof FunctionCall call)) {
            return true;
        }
        Optional<BuiltinFunction> builtin = dialect.builtin(call.functionName().name());
        if (builtin.isEmpty() || !builtin.get().movable()) {
            return false;
        }
        return call.arguments().stream().allMatch(a -> isMovable(a, dialect));
    }

    /**
     * @return True if the expression can be removed when its value is not used.
     */
    public static boolean isSideEffectFree(Expression expression, Dialect dialect) {
        if (!(expression instanceof FunctionCall call)) {
            return true;
        }
        Optional<BuiltinFunction> builtin = dialect.builtin(call.functionName().name());
        if (builtin.isEmpty() || !builtin.get().sideEffectFree()) {
            return false;
        }
        return call.arguments().stream().allMatch(a -> isSideEffectFree(a, dialect));
    }

    /**
     * @return True if the expression is a call of a builtin after which control never continues.
     */
    public static boolean isTerminatingCall(Expression expression, Dialect dialect) {
        return expression instanceof FunctionCall call
                && dialect.builtin(call.functionName().name()).map(BuiltinFunction::terminating).orElse(false);
    }
}

package org.optiscope.compiler.dialect;

/**
 * Describes a builtin function of a dialect.
 *
 * @param name             The function name.
 * @param parameters       The number of arguments.
 * @param returns          The number of returned values (0 or 1).
 * @param movable          True if the call can be freely moved or duplicated: no side effects and
 *                         no dependence on mutable state.
 * @param sideEffectFree   True if the call can be removed when its result is unused.
 * @param terminating      True if control never continues after the call.
 * @param literalArguments True if all arguments must be string literals naming objects or data.
 */
public record BuiltinFunction(
        String name,
        int parameters,
        int returns,
        boolean movable,
        boolean sideEffectFree,
        boolean terminating,
        boolean literalArguments
) {
}

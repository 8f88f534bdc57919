package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.dialect.Dialect;

import java.util.Set;

/**
 * Everything a step may use besides the code it transforms. A fresh context is created before
 * every step so the name dispenser starts from the names actually in use.
 *
 * @param dialect             The session dialect.
 * @param nameDispenser       The allocator for fresh identifiers.
 * @param reservedIdentifiers Names no step may introduce.
 * @param settings            Tuning values.
 */
public record StepContext(Dialect dialect, NameDispenser nameDispenser, Set<String> reservedIdentifiers,
                          OptimiserSettings settings) {

    public StepContext {
        reservedIdentifiers = Set.copyOf(reservedIdentifiers);
    }
}

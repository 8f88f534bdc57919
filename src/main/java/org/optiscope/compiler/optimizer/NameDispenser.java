package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.dialect.Dialect;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers that collide with no builtin, keyword, reserved identifier or name
 * already in use. Every name handed out is marked as used.
 */
public class NameDispenser {

    private final Dialect dialect;
    private final Set<String> reserved;
    private final Set<String> used;
    private int counter = 0;

    /**
     * @param dialect   The dialect whose builtins and keywords are illegal names.
     * @param reserved  Identifiers that must never be produced.
     * @param usedNames Names already present in the code.
     */
    public NameDispenser(Dialect dialect, Set<String> reserved, Set<String> usedNames) {
        this.dialect = dialect;
        this.reserved = Set.copyOf(reserved);
        this.used = new HashSet<>(usedNames);
    }

    public NameDispenser(Dialect dialect, Set<String> reserved) {
        this(dialect, reserved, Set.of());
    }

    /**
     * Returns the hint itself if it is a legal unused name, otherwise {@code hint_N} for the
     * next counter value that yields a legal name. An empty hint yields {@code _N}.
     *
     * @param hint The preferred name, may be empty.
     * @return A fresh name, now marked as used.
     */
    public String newName(String hint) {
        String name = hint;
        while (name.isEmpty() || illegal(name)) {
            counter++;
            name = hint + "_" + counter;
        }
        used.add(name);
        return name;
    }

    public boolean isUsed(String name) {
        return used.contains(name);
    }

    private boolean illegal(String name) {
        return used.contains(name) || reserved.contains(name) || dialect.isBuiltin(name) || dialect.isKeyword(name);
    }
}

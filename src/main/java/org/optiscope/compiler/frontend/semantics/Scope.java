package org.optiscope.compiler.frontend.semantics;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A lexical scope. Blocks open plain scopes; function definitions open a boundary scope holding
 * the parameters and return variables. Variables beyond a function boundary are not accessible,
 * but their names still cannot be redeclared inside the function.
 */
public class Scope {

    private final Scope parent;
    private final boolean functionBoundary;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(Scope parent, boolean functionBoundary) {
        this.parent = parent;
        this.functionBoundary = functionBoundary;
    }

    public Scope getParent() {
        return parent;
    }

    public boolean isFunctionBoundary() {
        return functionBoundary;
    }

    public Optional<Symbol> lookupLocal(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    void add(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }

    /**
     * Checks whether the name is declared here or in any enclosing scope, across function boundaries.
     */
    public boolean exists(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.symbols.containsKey(name)) return true;
        }
        return false;
    }
}

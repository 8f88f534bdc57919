package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Identifier;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic facts about one code block, produced by a successful analysis.
 * All maps are keyed by node identity, so the info is only meaningful for the exact block
 * instance it was computed from.
 */
public final class AnalysisInfo {

    private final Map<AstNode, Scope> scopes = new IdentityHashMap<>();
    private final Map<Identifier, Symbol> references = new IdentityHashMap<>();
    private final Map<AstNode, Symbol> declarations = new IdentityHashMap<>();
    private final Set<String> declaredNames = new LinkedHashSet<>();

    void registerScope(AstNode owner, Scope scope) {
        scopes.put(owner, scope);
    }

    void registerReference(Identifier identifier, Symbol symbol) {
        references.put(identifier, symbol);
    }

    void registerDeclaration(Symbol symbol) {
        declarations.put(symbol.declaration(), symbol);
        declaredNames.add(symbol.name());
    }

    /**
     * @param owner A {@code Block} or {@code FunctionDefinition}.
     * @return The scope the node opens.
     */
    public Optional<Scope> scopeOf(AstNode owner) {
        return Optional.ofNullable(scopes.get(owner));
    }

    /**
     * @return The symbol the identifier resolves to; empty for builtin calls.
     */
    public Optional<Symbol> referencedSymbol(Identifier identifier) {
        return Optional.ofNullable(references.get(identifier));
    }

    /**
     * @param declaration A {@code TypedName} or {@code FunctionDefinition}.
     */
    public Optional<Symbol> declaredSymbol(AstNode declaration) {
        return Optional.ofNullable(declarations.get(declaration));
    }

    public Set<String> getDeclaredNames() {
        return Collections.unmodifiableSet(declaredNames);
    }

    public int getDeclarationCount() {
        return declarations.size();
    }
}

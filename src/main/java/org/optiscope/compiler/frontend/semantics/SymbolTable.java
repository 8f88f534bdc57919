package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Scope bookkeeping for one analysis run. Scopes are pre-built by the {@link ScopeFiller}
 * (pass 1, which also registers functions) and then re-entered by the analysis handlers (pass 2),
 * which declare variables in statement order so that use-before-declaration is detected.
 */
public class SymbolTable {

    private final Dialect dialect;
    private final DiagnosticsEngine diagnostics;
    private final AnalysisInfo info = new AnalysisInfo();
    private final Deque<ControlContext> contexts = new ArrayDeque<>();
    private Scope currentScope;

    /**
     * @param dialect     The dialect whose builtin names cannot be redeclared.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(Dialect dialect, DiagnosticsEngine diagnostics) {
        this.dialect = dialect;
        this.diagnostics = diagnostics;
        this.contexts.push(ControlContext.TOP_LEVEL);
    }

    // === Scope management ===

    /**
     * Creates the scope a block or function definition opens.
     * @param owner            The owning node.
     * @param parent           The enclosing scope, {@code null} for the outermost block.
     * @param functionBoundary True for the parameter scope of a function.
     * @return The new scope.
     */
    public Scope createScope(AstNode owner, Scope parent, boolean functionBoundary) {
        Scope scope = new Scope(parent, functionBoundary);
        info.registerScope(owner, scope);
        return scope;
    }

    /**
     * Returns the scope pass 1 created for the node.
     * @throws IllegalStateException if pass 1 did not visit the node.
     */
    public Scope scopeOf(AstNode owner) {
        return info.scopeOf(owner).orElseThrow(
                () -> new IllegalStateException("No scope was created for " + owner.getClass().getSimpleName()
                        + " at " + owner.location()));
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    public void setCurrentScope(Scope scope) {
        this.currentScope = scope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope != null) {
            currentScope = currentScope.getParent();
        }
    }

    // === Control context ===

    public void pushContext(ControlContext context) {
        contexts.push(context);
    }

    public void popContext() {
        contexts.pop();
    }

    public ControlContext currentContext() {
        return contexts.peek();
    }

    public boolean insideFunction() {
        return contexts.contains(ControlContext.FUNCTION);
    }

    // === Declarations ===

    /**
     * Registers a function in the given scope. Called by the pass-1 collector.
     */
    public void defineFunction(FunctionDefinition function, Scope scope) {
        if (!checkDeclarableName(function.name(), function.location())) {
            return;
        }
        if (scope.exists(function.name())) {
            diagnostics.reportError("Function name \"" + function.name() + "\" already taken in this scope.",
                    function.location());
            return;
        }
        Symbol symbol = new Symbol(function.name(), Symbol.Type.FUNCTION, function,
                function.parameters().size(), function.returnVariables().size());
        scope.add(symbol);
        info.registerDeclaration(symbol);
    }

    /**
     * Declares a variable in the current scope. Reports an error if the name is visible
     * from here, since shadowing is not allowed.
     */
    public void defineVariable(TypedName name) {
        if (!checkDeclarableName(name.name(), name.location())) {
            return;
        }
        if (currentScope.exists(name.name())) {
            diagnostics.reportError("Variable name \"" + name.name() + "\" already taken in this scope.",
                    name.location());
            return;
        }
        Symbol symbol = Symbol.variable(name.name(), name);
        currentScope.add(symbol);
        info.registerDeclaration(symbol);
    }

    private boolean checkDeclarableName(String name, SourceLocation location) {
        if (dialect.isBuiltin(name)) {
            diagnostics.reportError("Cannot use builtin function name \"" + name + "\" as identifier name.",
                    location);
            return false;
        }
        return true;
    }

    // === Resolution ===

    /**
     * Resolves an identifier from the current scope outwards and records the reference.
     * Variables declared outside the innermost enclosing function are reported as inaccessible.
     * @param identifier The identifier to resolve.
     * @return The resolved symbol, or empty if unknown or inaccessible.
     */
    public Optional<Symbol> resolve(Identifier identifier) {
        boolean crossedFunctionBoundary = false;
        for (Scope scope = currentScope; scope != null; scope = scope.getParent()) {
            Optional<Symbol> found = scope.lookupLocal(identifier.name());
            if (found.isPresent()) {
                Symbol symbol = found.get();
                if (crossedFunctionBoundary && !symbol.isFunction()) {
                    diagnostics.reportError("Variable \"" + identifier.name()
                            + "\" is declared outside the function and cannot be accessed here.",
                            identifier.location());
                    return Optional.empty();
                }
                info.registerReference(identifier, symbol);
                return found;
            }
            if (scope.isFunctionBoundary()) {
                crossedFunctionBoundary = true;
            }
        }
        return Optional.empty();
    }

    public AnalysisInfo getAnalysisInfo() {
        return info;
    }
}

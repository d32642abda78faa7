package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Block-structured name binding for the type checker. The root scope holds built-ins, the
 * module scope holds functions and imported names, and every function body, block and loop
 * opens a child scope. Lookups walk from the innermost scope outwards.
 */
public class SymbolTable {

    /**
     * One block of bindings.
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        /**
         * @return The symbols declared directly in this scope, in declaration order.
         */
        public Map<String, Symbol> symbols() {
            return Collections.unmodifiableMap(symbols);
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Receives {@code DUPLICATE_DECLARATION} errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Opens a child of the current scope and makes it current.
     * @return The opened scope.
     */
    public Scope enterScope() {
        currentScope = new Scope(currentScope);
        return currentScope;
    }

    /**
     * Closes the current scope. The root scope is never closed.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    /**
     * Binds a name in the current scope.
     * Reports an error if the name is already defined in the current scope; shadowing a symbol
     * of an enclosing scope is allowed.
     * @param symbol The symbol to define.
     * @return true if the symbol was defined.
     */
    public boolean define(Symbol symbol) {
        Symbol existing = currentScope.symbols.get(symbol.name());
        if (existing != null) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_DECLARATION,
                    "'" + symbol.name() + "' is already defined in this scope (at " + existing.declaredAt() + ").",
                    symbol.declaredAt());
            return false;
        }
        currentScope.symbols.put(symbol.name(), symbol);
        return true;
    }

    /**
     * Looks a name up, innermost scope first.
     * @param name The name to resolve.
     * @return The nearest binding of the name.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The root (module) scope.
     */
    public Scope rootScope() {
        return rootScope;
    }
}

package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing lexical scopes during reference resolution.
 * It supports nested scopes and resolving symbols from the current scope outwards.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private final List<SemanticError> errors;
    private final String phase;

    /**
     * Constructs a new symbol table.
     * @param errors The sink for duplicate-name errors.
     * @param phase The stage identity recorded on reported errors.
     */
    public SymbolTable(List<SemanticError> errors, String phase) {
        this.errors = errors;
        this.phase = phase;
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new scope nested in the current one.
     */
    public void enterScope() {
        currentScope = new Scope(currentScope);
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    /**
     * Defines a new symbol in the current scope.
     * Reports a {@link SemanticError.DuplicateName} if the name is already defined in
     * this scope; the first definition stays in effect.
     * @param symbol The symbol to define.
     */
    public void define(Symbol symbol) {
        Symbol existing = currentScope.symbols.putIfAbsent(symbol.name(), symbol);
        if (existing != null) {
            errors.add(new SemanticError.DuplicateName(symbol.name(), existing.span(), symbol.span(), null, phase));
        }
    }

    /**
     * Defines a symbol in the root scope unless the name is taken. Top-level collisions
     * are reported by the duplicate name checker, so nothing is reported here.
     * @param symbol The symbol to define.
     */
    public void defineGlobal(Symbol symbol) {
        rootScope.symbols.putIfAbsent(symbol.name(), symbol);
    }

    /**
     * Resolves a name, searching from the current scope upwards to the root.
     * @param name The name to resolve.
     * @return An optional containing the found symbol, or empty if not found.
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
}

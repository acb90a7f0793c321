package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A symbol table for managing scopes and symbols during semantic analysis.
 * <p>
 * Scopes form a chain from the current scope back to the global scope. Declarations
 * go into the current scope only; lookups walk the chain outwards, so inner declarations
 * shadow outer ones. Errors are recorded in the table's error list and never thrown.
 */
public class SymbolTable {

    private final Scope globalScope;
    private final List<Scope> allScopes = new ArrayList<>();
    private final List<SemanticError> errors = new ArrayList<>();
    private Scope currentScope;

    /**
     * Constructs a new symbol table containing only the global scope.
     */
    public SymbolTable() {
        this.globalScope = new Scope(null);
        this.allScopes.add(globalScope);
        this.currentScope = globalScope;
    }

    /**
     * Enters a new scope nested in the current one.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope newScope = new Scope(currentScope);
        allScopes.add(newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     * @return {@code false} if the current scope is the global scope, which cannot be left.
     */
    public boolean exitScope() {
        if (currentScope.isGlobal()) {
            report("Cannot exit the global scope", SourcePosition.UNKNOWN, SemanticErrorCode.INVALID_OPERATION);
            return false;
        }
        currentScope = currentScope.parentOrNull();
        return true;
    }

    /**
     * Declares a symbol in the current scope.
     * Reports a redefinition error and leaves the scope unchanged if the name is already
     * declared in this exact scope. Shadowing a name of an enclosing scope is allowed.
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added.
     */
    public boolean add(Symbol symbol) {
        if (currentScope.contains(symbol.name())) {
            report(String.format("Symbol '%s' already defined in this scope", symbol.name()),
                    symbol.position(), SemanticErrorCode.REDEFINED_SYMBOL);
            return false;
        }
        currentScope.put(symbol);
        return true;
    }

    /**
     * Resolves a symbol by name, searching from the current scope outwards to the global scope.
     * @param name The name of the symbol to resolve.
     * @return An optional containing the found symbol, or empty if not found.
     */
    public Optional<Symbol> lookup(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parentOrNull()) {
            Symbol symbol = scope.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a symbol in the current scope only.
     * @param name The name of the symbol to resolve.
     * @return An optional containing the found symbol, or empty if not found.
     */
    public Optional<Symbol> lookupLocal(String name) {
        return Optional.ofNullable(currentScope.get(name));
    }

    /**
     * Records that the named symbol is referenced.
     * @param name The referenced name.
     * @param position The position of the reference, used for the error if the name is unknown.
     * @return {@code true} if the symbol exists.
     */
    public boolean markUsed(String name, SourcePosition position) {
        Optional<Symbol> symbol = lookup(name);
        if (symbol.isEmpty()) {
            report(String.format("Undefined symbol '%s'", name), position, SemanticErrorCode.UNDEFINED_SYMBOL);
            return false;
        }
        symbol.get().markUsed();
        return true;
    }

    /**
     * Marks a symbol that was already resolved as used.
     * @param symbol The resolved symbol.
     */
    public void markUsed(Symbol symbol) {
        symbol.markUsed();
    }

    /**
     * Appends an error to the table's error list.
     * @param message The error message.
     * @param position The position of the error, or null if unknown.
     * @param code The error classification.
     */
    public void report(String message, SourcePosition position, SemanticErrorCode code) {
        errors.add(new SemanticError(message, position == null ? SourcePosition.UNKNOWN : position, code));
    }

    public Scope currentScope() {
        return currentScope;
    }

    public Scope globalScope() {
        return globalScope;
    }

    /**
     * @return Every scope created by this table in creation order, starting with the global scope.
     */
    public List<Scope> allScopes() {
        return Collections.unmodifiableList(allScopes);
    }

    /**
     * @return An unmodifiable view of the errors reported so far, in order.
     */
    public List<SemanticError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return All declared symbols of all scopes that were never marked used.
     */
    public List<Symbol> unusedSymbols() {
        return allScopes.stream()
                .flatMap(scope -> scope.symbols().stream())
                .filter(symbol -> !symbol.isUsed())
                .collect(Collectors.toList());
    }
}

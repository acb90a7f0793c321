package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.util.ChainedHashMap;

import java.util.List;
import java.util.Optional;

/**
 * A lexical scope: a map of the names declared directly in it plus a link to the
 * enclosing scope. The global scope has level 0 and no parent.
 */
public final class Scope {

    private final Scope parent;
    private final int level;
    private final ChainedHashMap<String, Symbol> symbols = new ChainedHashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
        this.level = parent == null ? 0 : parent.level + 1;
    }

    /**
     * @return The enclosing scope, or empty for the global scope.
     */
    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    Scope parentOrNull() {
        return parent;
    }

    public int level() {
        return level;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    Symbol get(String name) {
        return symbols.get(name);
    }

    void put(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    /**
     * @return A snapshot of the symbols declared directly in this scope.
     */
    public List<Symbol> symbols() {
        return symbols.values();
    }

    public int size() {
        return symbols.size();
    }
}

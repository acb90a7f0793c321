package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.parser.ast.AstNode;

import java.util.Objects;

/**
 * Represents a single named entity (variable, template, prompt, constraint or parameter)
 * in the symbol table. Everything but the usage flag is fixed at declaration.
 */
public final class Symbol {

    private final String name;
    private final SymbolKind kind;
    private final AstNode node;
    private final SourcePosition position;
    private final boolean defined;
    private boolean used;

    /**
     * @param name The symbol's name.
     * @param kind The symbol's kind.
     * @param node The declaring AST node, or null (e.g. for parameters).
     * @param position Where the symbol is declared.
     */
    public Symbol(String name, SymbolKind kind, AstNode node, SourcePosition position) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.node = node;
        this.position = position;
        this.defined = kind != SymbolKind.UNKNOWN;
    }

    /**
     * Creates a symbol without an associated AST node.
     */
    public Symbol(String name, SymbolKind kind, SourcePosition position) {
        this(name, kind, null, position);
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    /**
     * @return The declaring AST node, or null.
     */
    public AstNode node() {
        return node;
    }

    public SourcePosition position() {
        return position;
    }

    public boolean isDefined() {
        return defined;
    }

    public boolean isUsed() {
        return used;
    }

    void markUsed() {
        this.used = true;
    }

    @Override
    public String toString() {
        return name + ":" + kind;
    }
}

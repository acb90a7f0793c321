package org.pcc.compiler.frontend.semantics;

/**
 * The kind of entity a {@link Symbol} names.
 */
public enum SymbolKind {
    /** Declared with VAR, or a FOR loop variable. */
    VARIABLE,
    /** Declared with TEMPLATE. */
    TEMPLATE,
    /** Declared with PROMPT. */
    PROMPT,
    /** Declared with CONSTRAINT. */
    CONSTRAINT,
    /** A template parameter. */
    PARAMETER,
    UNKNOWN;

    /**
     * @return {@code true} if a {@code $name} reference may resolve to this kind.
     */
    public boolean isValue() {
        return this == VARIABLE || this == PARAMETER;
    }
}

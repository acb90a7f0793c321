package org.pcc.compiler.frontend.semantics;

/**
 * Classifies a {@link SemanticError}. The numeric codes are stable and may be shown to users.
 */
public enum SemanticErrorCode {
    /** A reference names nothing in the active scope chain. */
    UNDEFINED_SYMBOL(1),
    /** A name is declared twice in the same scope. */
    REDEFINED_SYMBOL(2),
    /** A reference resolves to a symbol of the wrong kind. */
    TYPE_MISMATCH(3),
    /** An operation is not allowed in the current state, e.g. leaving the global scope. */
    INVALID_OPERATION(4),
    /** A template call passes fewer arguments than the template declares. */
    MISSING_ARGUMENT(5),
    /** A template call passes more arguments than the template declares. */
    TOO_MANY_ARGUMENTS(6);

    private final int code;

    SemanticErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}

package org.pcc.compiler.diagnostics;

import org.pcc.compiler.api.SourcePosition;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param position The source position of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        SourcePosition position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s",
                type, position.fileName(), position.line(), position.column(), message);
    }
}

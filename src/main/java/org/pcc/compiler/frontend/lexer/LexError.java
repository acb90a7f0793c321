package org.pcc.compiler.frontend.lexer;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.diagnostics.Diagnostic;

/**
 * The error that stopped a {@link Lexer} run.
 *
 * @param message  What went wrong.
 * @param position The offending character.
 */
public record LexError(String message, SourcePosition position) {

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Type.ERROR, message, position);
    }
}

package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.diagnostics.Diagnostic;

/**
 * A syntax error recorded by the {@link Parser}.
 *
 * @param message What was expected and what was found.
 * @param position The offending token.
 */
public record ParseError(String message, SourcePosition position) {

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Type.ERROR, message, position);
    }
}

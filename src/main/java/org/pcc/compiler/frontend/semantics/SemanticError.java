package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.diagnostics.Diagnostic;

/**
 * An error found during semantic analysis.
 *
 * @param message The error message.
 * @param position The position of the offending reference or declaration.
 * @param code The error classification.
 */
public record SemanticError(String message, SourcePosition position, SemanticErrorCode code) {

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Type.ERROR, message, position);
    }
}

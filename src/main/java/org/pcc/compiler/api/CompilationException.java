package org.pcc.compiler.api;

import org.pcc.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and carries every diagnostic of the failing stage.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the diagnostics of the failing stage.
     * @param errorCode The stage that failed.
     * @param message The detail message.
     * @param diagnostics The diagnostics collected up to the failure.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.errorCode = errorCode;
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param errorCode The stage that failed.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.diagnostics = List.of();
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return An unmodifiable list of the diagnostics that caused this exception.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}

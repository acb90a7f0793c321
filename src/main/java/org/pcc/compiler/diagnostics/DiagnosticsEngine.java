package org.pcc.compiler.diagnostics;

import org.pcc.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) across
 * all compilation stages.
 * <p>
 * Stages keep their own typed error lists; the compiler facade funnels them
 * into one engine so callers get a single, ordered report.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message  The error message.
     * @param position The position of the error.
     */
    public void reportError(String message, SourcePosition position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, position));
    }

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param position The position of the warning.
     */
    public void reportWarning(String message, SourcePosition position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, position));
    }

    /**
     * Adds an already built diagnostic, e.g. one converted from a stage's error record.
     *
     * @param diagnostic The diagnostic to add.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Adds already built diagnostics, keeping their order.
     *
     * @param reported The diagnostics to add.
     */
    public void addAll(Collection<Diagnostic> reported) {
        diagnostics.addAll(reported);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}

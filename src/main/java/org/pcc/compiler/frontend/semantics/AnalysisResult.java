package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of {@link SemanticAnalyzer#analyze}.
 *
 * @param symbolTable The populated symbol table, positioned back at the global scope.
 * @param errors Every semantic error, in traversal order.
 * @param warnings Non-fatal findings such as unused variables.
 */
public record AnalysisResult(SymbolTable symbolTable, List<SemanticError> errors, List<Diagnostic> warnings) {

    public AnalysisResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean success() {
        return errors.isEmpty();
    }
}

package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.VariableRefNode;
import org.pcc.compiler.frontend.semantics.SemanticErrorCode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Checks that a {@code $name} reference resolves to a variable or a parameter.
 */
public class VariableRefAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        VariableRefNode ref = (VariableRefNode) node;
        Optional<Symbol> symbol = symbolTable.lookup(ref.name());
        if (symbol.isEmpty()) {
            symbolTable.report(String.format("Undefined variable '$%s'", ref.name()),
                    ref.position(), SemanticErrorCode.UNDEFINED_SYMBOL);
            return;
        }
        if (!symbol.get().kind().isValue()) {
            symbolTable.report(String.format("'$%s' is not a variable", ref.name()),
                    ref.position(), SemanticErrorCode.TYPE_MISMATCH);
            return;
        }
        symbolTable.markUsed(symbol.get());
    }
}

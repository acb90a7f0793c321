package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.IdentifierNode;
import org.pcc.compiler.frontend.semantics.SemanticErrorCode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * A bare identifier in an expression must name some declared symbol, of any kind.
 */
public class IdentifierAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        IdentifierNode id = (IdentifierNode) node;
        Optional<Symbol> symbol = symbolTable.lookup(id.name());
        if (symbol.isPresent()) {
            symbolTable.markUsed(symbol.get());
        } else {
            symbolTable.report(String.format("Undefined identifier '%s'", id.name()),
                    id.position(), SemanticErrorCode.UNDEFINED_SYMBOL);
        }
    }
}

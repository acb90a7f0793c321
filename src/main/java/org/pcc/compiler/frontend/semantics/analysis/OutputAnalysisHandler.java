package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.semantics.SemanticErrorCode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Checks that an OUTPUT specification names a prompt.
 */
public class OutputAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        OutputSpecNode output = (OutputSpecNode) node;
        String name = output.prompt().text();
        Optional<Symbol> symbol = symbolTable.lookup(name);
        if (symbol.isEmpty()) {
            symbolTable.report(String.format("Undefined prompt '%s' in OUTPUT specification", name),
                    output.position(), SemanticErrorCode.UNDEFINED_SYMBOL);
        } else if (symbol.get().kind() != SymbolKind.PROMPT) {
            symbolTable.report(String.format("'%s' is not a prompt in OUTPUT specification", name),
                    output.position(), SemanticErrorCode.TYPE_MISMATCH);
        } else {
            symbolTable.markUsed(symbol.get());
        }
    }
}

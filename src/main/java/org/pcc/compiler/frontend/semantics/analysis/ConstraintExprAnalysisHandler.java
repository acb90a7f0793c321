package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * Marks the subject of a constraint entry as used when it names a symbol.
 * Subjects such as {@code max_tokens} name prompt properties and need not resolve.
 */
public class ConstraintExprAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        ConstraintExprNode entry = (ConstraintExprNode) node;
        symbolTable.lookup(entry.subject().text()).ifPresent(symbolTable::markUsed);
    }
}

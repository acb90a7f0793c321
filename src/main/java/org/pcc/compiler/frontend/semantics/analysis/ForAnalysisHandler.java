package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.ForNode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * Opens a scope for a FOR loop and binds the loop variable in it. The iterable and
 * the body are analyzed inside that scope.
 */
public class ForAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        ForNode loop = (ForNode) node;
        symbolTable.enterScope();
        symbolTable.add(new Symbol(loop.variable(), SymbolKind.VARIABLE, loop, loop.variablePosition()));
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable) {
        symbolTable.exitScope();
    }
}

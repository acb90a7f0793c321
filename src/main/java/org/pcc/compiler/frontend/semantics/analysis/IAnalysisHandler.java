package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * An interface for handlers that perform semantic analysis on a specific type of AST node.
 * <p>
 * The analyzer calls {@link #analyze} before the node's children are visited and
 * {@link #afterChildren} once they are done, so a handler can open a scope in the first
 * and close it in the second.
 */
public interface IAnalysisHandler {

    /**
     * Analyzes the given AST node before its children.
     * @param node The AST node to analyze.
     * @param symbolTable The symbol table, which also collects the errors.
     */
    void analyze(AstNode node, SymbolTable symbolTable);

    /**
     * Called after all children of the node were analyzed.
     * @param node The AST node.
     * @param symbolTable The symbol table.
     */
    default void afterChildren(AstNode node, SymbolTable symbolTable) {
        // Most handlers have nothing to do here.
    }
}

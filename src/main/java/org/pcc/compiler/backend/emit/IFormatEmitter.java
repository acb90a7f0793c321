package org.pcc.compiler.backend.emit;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * Serializes an AST into one output format.
 */
public interface IFormatEmitter {

    /**
     * Renders the tree.
     * @param root The root to render, usually a {@link org.pcc.compiler.frontend.parser.ast.ProgramNode}.
     * @param symbolTable The symbol table from semantic analysis; read only, may be null.
     * @return The rendered text.
     */
    String emit(AstNode root, SymbolTable symbolTable);
}

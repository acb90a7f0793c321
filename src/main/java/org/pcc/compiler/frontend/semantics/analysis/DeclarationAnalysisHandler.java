package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * Registers PROMPT, VAR and CONSTRAINT declarations in the current scope before their
 * bodies are analyzed.
 */
public class DeclarationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        if (node instanceof PromptDefNode prompt) {
            define(prompt.name(), SymbolKind.PROMPT, node, symbolTable);
        } else if (node instanceof VarDeclNode var) {
            define(var.name(), SymbolKind.VARIABLE, node, symbolTable);
        } else if (node instanceof ConstraintDefNode constraint) {
            define(constraint.name(), SymbolKind.CONSTRAINT, node, symbolTable);
        }
    }

    private static void define(Token name, SymbolKind kind, AstNode node, SymbolTable symbolTable) {
        symbolTable.add(new Symbol(name.text(), kind, node, name.position()));
    }
}

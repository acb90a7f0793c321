package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.IdentifierNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.frontend.semantics.SymbolTable;

/**
 * Registers a template in the enclosing scope, then opens the template's own scope
 * holding its parameters. The scope is closed after the body was analyzed.
 */
public class TemplateAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        TemplateDefNode template = (TemplateDefNode) node;
        symbolTable.add(new Symbol(template.name().text(), SymbolKind.TEMPLATE, template, template.position()));

        symbolTable.enterScope();
        for (AstNode param : template.parameters().elements()) {
            IdentifierNode id = (IdentifierNode) param;
            symbolTable.add(new Symbol(id.name(), SymbolKind.PARAMETER, id.position()));
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable) {
        symbolTable.exitScope();
    }
}

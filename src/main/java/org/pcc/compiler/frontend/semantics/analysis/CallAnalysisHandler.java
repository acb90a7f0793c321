package org.pcc.compiler.frontend.semantics.analysis;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.CallNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.semantics.SemanticErrorCode;
import org.pcc.compiler.frontend.semantics.Symbol;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Resolves calls against TEMPLATE symbols and checks the argument count against the
 * template's parameter list. {@code @name(...)} and plain {@code name(...)} calls resolve alike.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        CallNode call = (CallNode) node;
        Optional<Symbol> symbol = symbolTable.lookup(call.name());
        if (symbol.isEmpty()) {
            symbolTable.report(String.format("Undefined template '%s'", call.name()),
                    call.position(), SemanticErrorCode.UNDEFINED_SYMBOL);
            return;
        }
        if (symbol.get().kind() != SymbolKind.TEMPLATE) {
            symbolTable.report(String.format("'%s' is not a template", call.name()),
                    call.position(), SemanticErrorCode.TYPE_MISMATCH);
            return;
        }
        symbolTable.markUsed(symbol.get());

        if (symbol.get().node() instanceof TemplateDefNode template) {
            int expected = template.arity();
            int actual = call.arguments().size();
            if (actual != expected) {
                SemanticErrorCode code = actual < expected
                        ? SemanticErrorCode.MISSING_ARGUMENT
                        : SemanticErrorCode.TOO_MANY_ARGUMENTS;
                symbolTable.report(String.format("Template '%s' expects %d argument(s) but got %d",
                        call.name(), expected, actual), call.position(), code);
            }
        }
    }
}

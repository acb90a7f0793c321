package org.pcc.compiler.frontend.parser.features.template;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.IStatementHandler;
import org.pcc.compiler.frontend.parser.ParsingContext;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.IdentifierNode;
import org.pcc.compiler.frontend.parser.ast.ListNode;

/**
 * Handles {@code TEMPLATE name(param, ...) { element* }}.
 */
public class TemplateStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume TEMPLATE
        Token name = context.consume(TokenType.IDENTIFIER, "Expected template name after TEMPLATE.");
        Token open = context.consume(TokenType.LEFT_PAREN, "Expected '(' after template name.");

        ListNode parameters = new ListNode(AstNodeKind.PARAMETER_LIST, open.position());
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                Token param = context.consume(TokenType.IDENTIFIER, "Expected parameter name.");
                parameters.add(new IdentifierNode(param.text(), param.position()));
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_PAREN, "Expected ')' after template parameters.");

        ListNode body = context.block();
        return new TemplateDefNode(name, parameters, body);
    }
}

package org.pcc.compiler.frontend.parser.features.prompt;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.IStatementHandler;
import org.pcc.compiler.frontend.parser.ParsingContext;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.ListNode;

/**
 * Handles {@code PROMPT name { element* }}.
 */
public class PromptStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume PROMPT
        Token name = context.consume(TokenType.IDENTIFIER, "Expected prompt name after PROMPT.");
        ListNode body = context.block();
        return new PromptDefNode(name, body);
    }
}

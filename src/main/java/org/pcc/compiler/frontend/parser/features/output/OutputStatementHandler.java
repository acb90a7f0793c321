package org.pcc.compiler.frontend.parser.features.output;

import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.IStatementHandler;
import org.pcc.compiler.frontend.parser.ParsingContext;
import org.pcc.compiler.frontend.parser.ast.AstNode;

/**
 * Handles {@code OUTPUT prompt AS JSON|TEXT|MARKDOWN;}.
 */
public class OutputStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume OUTPUT
        Token prompt = context.consume(TokenType.IDENTIFIER, "Expected prompt name after OUTPUT.");
        context.consume(TokenType.AS, "Expected AS after prompt name.");
        Token formatToken = context.consume(TokenType.IDENTIFIER, "Expected output format after AS.");
        OutputFormat format = OutputFormat.fromName(formatToken.text())
                .orElseThrow(() -> context.error(formatToken,
                        "Unknown output format '" + formatToken.text() + "', expected JSON, TEXT or MARKDOWN."));
        context.consume(TokenType.SEMICOLON, "Expected ';' after output specification.");
        return new OutputSpecNode(prompt, format);
    }
}

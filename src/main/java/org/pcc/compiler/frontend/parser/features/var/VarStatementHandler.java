package org.pcc.compiler.frontend.parser.features.var;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.IStatementHandler;
import org.pcc.compiler.frontend.parser.ParsingContext;
import org.pcc.compiler.frontend.parser.ast.AstNode;

/**
 * Handles {@code VAR name = expression;}.
 */
public class VarStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume VAR
        Token name = context.consume(TokenType.IDENTIFIER, "Expected variable name after VAR.");
        context.consume(TokenType.EQUAL, "Expected '=' after variable name.");
        AstNode initializer = context.expression();
        context.consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
        return new VarDeclNode(name, initializer);
    }
}

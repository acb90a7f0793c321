package org.pcc.compiler.frontend.parser.features.constraint;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.IStatementHandler;
import org.pcc.compiler.frontend.parser.ParsingContext;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.ListNode;
import org.pcc.compiler.frontend.parser.ast.Operator;

import java.util.Map;

/**
 * Handles {@code CONSTRAINT name { subject op value; ... }}.
 */
public class ConstraintStatementHandler implements IStatementHandler {

    private static final Map<TokenType, Operator> COMPARISONS = Map.of(
            TokenType.EQUAL_EQUAL, Operator.EQUAL,
            TokenType.BANG_EQUAL, Operator.NOT_EQUAL,
            TokenType.LESS, Operator.LESS,
            TokenType.GREATER, Operator.GREATER,
            TokenType.LESS_EQUAL, Operator.LESS_EQUAL,
            TokenType.GREATER_EQUAL, Operator.GREATER_EQUAL
    );

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume CONSTRAINT
        Token name = context.consume(TokenType.IDENTIFIER, "Expected constraint name after CONSTRAINT.");
        Token open = context.consume(TokenType.LEFT_BRACE, "Expected '{' after constraint name.");

        ListNode constraints = new ListNode(AstNodeKind.CONSTRAINT_LIST, open.position());
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            Token subject = context.consume(TokenType.IDENTIFIER, "Expected identifier in constraint.");
            Token op = context.advance();
            Operator operator = COMPARISONS.get(op.type());
            if (operator == null) {
                throw context.error(op, "Expected comparison operator in constraint but found '" + op.text() + "'.");
            }
            AstNode value = context.expression();
            context.consume(TokenType.SEMICOLON, "Expected ';' after constraint.");
            constraints.add(new ConstraintExprNode(subject, operator, value));
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after constraint block.");
        return new ConstraintDefNode(name, constraints);
    }
}

package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.ListNode;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement handlers with access to the token stream and the shared
 * sub-parsers without coupling them directly to the {@link Parser}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it records a syntax error and abandons the current statement.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     * @throws ParseException if the type did not match.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Records a syntax error at the given token.
     * @param token The offending token.
     * @param message The error message.
     * @return An exception for the caller to throw.
     */
    ParseException error(Token token, String message);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Parses an expression starting at the current token.
     * @return The expression node.
     */
    AstNode expression();

    /**
     * Parses a braced block of prompt elements: {@code "{" element* "}"}.
     * @return An {@link org.pcc.compiler.frontend.parser.ast.AstNodeKind#ELEMENT_LIST}.
     */
    ListNode block();
}

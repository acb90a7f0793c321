package org.pcc.compiler.frontend.lexer;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of {@link Lexer#scanTokens()}.
 *
 * @param tokens The tokens scanned. Ends with {@link TokenType#END_OF_FILE} when no error occurred,
 *               otherwise holds the tokens scanned before the error.
 * @param error  The error that stopped scanning, if any.
 */
public record LexResult(List<Token> tokens, Optional<LexError> error) {

    public LexResult {
        tokens = List.copyOf(tokens);
    }

    public boolean success() {
        return error.isEmpty();
    }
}

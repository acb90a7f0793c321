package org.pcc.compiler.frontend.lexer;

import org.pcc.compiler.api.SourcePosition;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the decoded content of a string, the
 *              {@link Double} of a number, the {@link Boolean} of {@code true}/{@code false},
 *              or the bare name of a {@code $name}/{@code @name} token. Null otherwise.
 * @param position Where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        SourcePosition position
) {
    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public String fileName() {
        return position.fileName();
    }
}

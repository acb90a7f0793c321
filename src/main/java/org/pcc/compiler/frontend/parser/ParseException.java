package org.pcc.compiler.frontend.parser;

/**
 * Unwinds the parser out of a broken statement. The matching {@link ParseError}
 * has already been recorded when this is thrown.
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message, null, false, false);
    }
}

package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.frontend.parser.ast.AstNode;

/**
 * Parses one kind of top-level statement. Handlers are selected by the statement's
 * leading keyword, which is still the current token when {@link #parse} is called.
 */
public interface IStatementHandler {

    /**
     * Parses the statement.
     * @param context The parsing context.
     * @return The statement node.
     * @throws ParseException if the statement is malformed.
     */
    AstNode parse(ParsingContext context);
}

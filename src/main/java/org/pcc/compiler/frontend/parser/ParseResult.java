package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The outcome of {@link Parser#parse()}: the program, built from every statement that
 * parsed cleanly, and the errors of the statements that did not.
 *
 * @param program The program root; never null.
 * @param errors The syntax errors in source order.
 */
public record ParseResult(ProgramNode program, List<ParseError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return errors.isEmpty();
    }
}

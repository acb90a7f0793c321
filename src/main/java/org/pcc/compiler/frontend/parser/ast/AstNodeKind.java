package org.pcc.compiler.frontend.parser.ast;

import java.util.Locale;

/**
 * The kind tag of every AST node.
 */
public enum AstNodeKind {
    PROGRAM,

    // region Declarations
    PROMPT_DEF,
    VAR_DECL,
    TEMPLATE_DEF,
    CONSTRAINT_DEF,
    OUTPUT_SPEC,
    // endregion

    // region Expressions
    IDENTIFIER,
    STRING_LITERAL,
    NUMBER_LITERAL,
    BOOLEAN_LITERAL,
    BINARY_EXPR,
    UNARY_EXPR,
    VARIABLE_REF,
    FUNCTION_CALL,
    TEMPLATE_CALL,
    // endregion

    // region Control flow
    IF_STMT,
    FOR_STMT,
    WHILE_STMT,
    // endregion

    // region Body elements
    TEXT_ELEMENT,
    CONSTRAINT_EXPR,
    // endregion

    // region Lists
    STATEMENT_LIST,
    EXPRESSION_LIST,
    ARGUMENT_LIST,
    PARAMETER_LIST,
    CONSTRAINT_LIST,
    ELEMENT_LIST,
    // endregion

    /** The absent node left behind when dead-code elimination removes a branch. */
    EMPTY;

    /**
     * @return {@code true} for the list container kinds.
     */
    public boolean isList() {
        return ordinal() >= STATEMENT_LIST.ordinal() && ordinal() <= ELEMENT_LIST.ordinal();
    }

    /**
     * @return The lower-case name used as {@code "type"} tag in JSON output, e.g. {@code element_list}.
     */
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

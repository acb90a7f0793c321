package org.pcc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    PROMPT, VAR, TEMPLATE, CONSTRAINT, OUTPUT,
    IF, ELSE, FOR, WHILE, IN, AS,
    AND, OR, NOT, RAW,
    /** The literal {@code true}. */
    TRUE,
    /** The literal {@code false}. */
    FALSE,

    // Literals.
    /** An identifier, such as a variable or prompt name. */
    IDENTIFIER,
    /** A string literal in single or double quotes. */
    STRING,
    /** A numeric literal without sign or exponent. */
    NUMBER,
    /** A variable reference of the form {@code $name}. */
    VARIABLE_REF,
    /** A template call of the form {@code @name}. */
    TEMPLATE_CALL,

    // Operators.
    EQUAL_EQUAL, BANG_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
    /** A single {@code =}, used in VAR declarations. */
    EQUAL,
    /** A single {@code !}, logical negation. */
    BANG,

    // Punctuation.
    LEFT_BRACE, RIGHT_BRACE, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, COLON, DOT,

    /** Represents the end of the source file. */
    END_OF_FILE
}

package org.pcc.compiler.frontend.parser.ast;

/**
 * Operators of binary and unary expressions, with their source spelling.
 */
public enum Operator {
    OR("OR"),
    AND("AND"),
    NOT("NOT"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    IN("IN"),
    NOT_IN("NOT IN"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    POWER("^"),
    NEGATE("-"),
    BANG("!");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for the two logical negations {@code NOT} and {@code !}.
     */
    public boolean isLogicalNegation() {
        return this == NOT || this == BANG;
    }
}

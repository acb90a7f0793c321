package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * An AST node that represents a numeric literal. All numbers are real numbers.
 *
 * @param value The value.
 * @param position Where the literal starts.
 */
public record NumberLiteralNode(double value, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.NUMBER_LITERAL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * An AST node for an infix expression such as {@code a + b} or {@code $x IN list}.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 * @param position The position of the operator token.
 */
public record BinaryExprNode(Operator operator, AstNode left, AstNode right, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.BINARY_EXPR;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * An AST node for a prefix expression: {@code -x}, {@code !x} or {@code NOT x}.
 *
 * @param operator One of {@link Operator#NEGATE}, {@link Operator#BANG}, {@link Operator#NOT}.
 * @param operand The operand.
 * @param position The position of the operator token.
 */
public record UnaryExprNode(Operator operator, AstNode operand, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.UNARY_EXPR;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

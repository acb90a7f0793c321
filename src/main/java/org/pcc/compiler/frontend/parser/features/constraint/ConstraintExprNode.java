package org.pcc.compiler.frontend.parser.features.constraint;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;
import org.pcc.compiler.frontend.parser.ast.Operator;

import java.util.List;

/**
 * One entry of a constraint block: {@code subject operator value;}, e.g. {@code max_tokens <= 500;}.
 *
 * @param subject The constrained property or variable.
 * @param operator A comparison operator.
 * @param value The bound.
 */
public record ConstraintExprNode(Token subject, Operator operator, AstNode value) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.CONSTRAINT_EXPR;
    }

    @Override
    public SourcePosition position() {
        return subject.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.features.constraint;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;
import org.pcc.compiler.frontend.parser.ast.ListNode;

import java.util.List;

/**
 * An AST node that represents a named constraint block ({@code CONSTRAINT name { ... }}).
 *
 * @param name The token containing the name of the constraint.
 * @param constraints A {@link AstNodeKind#CONSTRAINT_LIST} of {@link ConstraintExprNode}s.
 */
public record ConstraintDefNode(Token name, ListNode constraints) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.CONSTRAINT_DEF;
    }

    @Override
    public SourcePosition position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(constraints);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

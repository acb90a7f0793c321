package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional body element.
 *
 * @param condition The condition expression.
 * @param thenBranch The elements of the then block.
 * @param elseBranch An {@link AstNodeKind#ELEMENT_LIST} for a plain else block, another
 *                   {@link IfNode} for {@code ELSE IF}, or null.
 * @param position The position of the IF keyword.
 */
public record IfNode(AstNode condition, ListNode thenBranch, AstNode elseBranch, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.IF_STMT;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(3);
        children.add(condition);
        children.add(thenBranch);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

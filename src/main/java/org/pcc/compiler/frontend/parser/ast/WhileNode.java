package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code WHILE condition { ... }} body element. Never executed.
 */
public record WhileNode(AstNode condition, ListNode body, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.WHILE_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code FOR variable IN iterable { ... }} body element. Never unrolled.
 *
 * @param variable The loop variable name.
 * @param variablePosition Where the loop variable is declared.
 * @param iterable The expression iterated over.
 * @param body The loop body.
 * @param position The position of the FOR keyword.
 */
public record ForNode(String variable, SourcePosition variablePosition, AstNode iterable, ListNode body,
                      SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.FOR_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(iterable, body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

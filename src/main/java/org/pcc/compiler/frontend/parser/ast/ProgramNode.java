package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * The root of every AST.
 *
 * @param statements The top-level PROMPT, VAR, TEMPLATE and CONSTRAINT statements.
 * @param outputs The OUTPUT specifications, kept apart because they describe how to emit
 *                the program rather than what it contains.
 * @param position The start of the source.
 */
public record ProgramNode(ListNode statements, ListNode outputs, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.PROGRAM;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(statements, outputs);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

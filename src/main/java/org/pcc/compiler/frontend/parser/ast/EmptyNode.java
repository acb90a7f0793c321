package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * Placeholder for a removed node, e.g. an {@code IF false} without else branch.
 * List containers drop it; elsewhere it renders as nothing.
 */
public record EmptyNode(SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.EMPTY;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * An AST node for {@code true} or {@code false}.
 */
public record BooleanLiteralNode(boolean value, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.BOOLEAN_LITERAL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

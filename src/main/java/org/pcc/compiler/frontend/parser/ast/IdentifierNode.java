package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * An AST node that represents a bare identifier used as an expression.
 *
 * @param name The identifier text.
 * @param position Where the identifier starts.
 */
public record IdentifierNode(String name, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

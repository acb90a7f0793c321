package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * An AST node that represents a string literal inside an expression.
 *
 * @param value The decoded string content without quotes.
 * @param position Where the literal starts.
 */
public record StringLiteralNode(String value, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.STRING_LITERAL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * A literal text segment of a prompt or template body.
 *
 * @param text The text, with escapes already decoded.
 * @param raw {@code true} if written as {@code RAW "..."}, which disables {@code $name} interpolation.
 * @param position The position of the string token the text came from.
 */
public record TextElementNode(String text, boolean raw, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.TEXT_ELEMENT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

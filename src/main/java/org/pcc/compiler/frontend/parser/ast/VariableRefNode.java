package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

/**
 * A {@code $name} reference, either inside an expression or as a prompt body element.
 *
 * @param name The variable name without the sigil.
 * @param position Where the reference starts.
 */
public record VariableRefNode(String name, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.VARIABLE_REF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

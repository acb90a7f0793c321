package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.List;

/**
 * A call expression. {@code @name(args)} calls a template and must resolve to a
 * TEMPLATE symbol; {@code name(args)} calls a built-in function and is not resolved.
 *
 * @param name The callee name without sigil.
 * @param template {@code true} for a template call.
 * @param arguments The {@link AstNodeKind#ARGUMENT_LIST}.
 * @param position Where the call starts.
 */
public record CallNode(String name, boolean template, ListNode arguments, SourcePosition position) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return template ? AstNodeKind.TEMPLATE_CALL : AstNodeKind.FUNCTION_CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

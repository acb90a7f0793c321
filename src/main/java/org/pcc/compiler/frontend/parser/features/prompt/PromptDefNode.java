package org.pcc.compiler.frontend.parser.features.prompt;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;
import org.pcc.compiler.frontend.parser.ast.ListNode;

import java.util.List;

/**
 * An AST node that represents a prompt definition ({@code PROMPT name { ... }}).
 *
 * @param name The token containing the name of the prompt.
 * @param body The prompt's elements.
 */
public record PromptDefNode(Token name, ListNode body) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.PROMPT_DEF;
    }

    @Override
    public SourcePosition position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.features.template;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;
import org.pcc.compiler.frontend.parser.ast.IdentifierNode;
import org.pcc.compiler.frontend.parser.ast.ListNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An AST node that represents a template definition ({@code TEMPLATE name(a, b) { ... }}).
 *
 * @param name The token containing the name of the template.
 * @param parameters A {@link AstNodeKind#PARAMETER_LIST} of {@link IdentifierNode}s.
 * @param body The template's elements.
 */
public record TemplateDefNode(Token name, ListNode parameters, ListNode body) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.TEMPLATE_DEF;
    }

    @Override
    public SourcePosition position() {
        return name.position();
    }

    /**
     * @return The parameter names in declaration order.
     */
    public List<String> parameterNames() {
        return parameters.elements().stream()
                .map(p -> ((IdentifierNode) p).name())
                .collect(Collectors.toList());
    }

    public int arity() {
        return parameters.size();
    }

    @Override
    public List<AstNode> getChildren() {
        // Parameters are bindings, not expressions; analysis registers them itself.
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

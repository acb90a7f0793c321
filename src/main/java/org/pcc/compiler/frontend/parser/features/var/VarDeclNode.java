package org.pcc.compiler.frontend.parser.features.var;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * An AST node that represents a variable declaration ({@code VAR name = value;}).
 *
 * @param name The token containing the variable name.
 * @param initializer The initial value expression.
 */
public record VarDeclNode(Token name, AstNode initializer) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.VAR_DECL;
    }

    @Override
    public SourcePosition position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

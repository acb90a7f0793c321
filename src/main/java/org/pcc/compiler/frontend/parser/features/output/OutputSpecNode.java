package org.pcc.compiler.frontend.parser.features.output;

import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.AstNodeKind;
import org.pcc.compiler.frontend.parser.ast.AstVisitor;

/**
 * An AST node that represents an output specification ({@code OUTPUT prompt AS JSON;}).
 *
 * @param prompt The token naming the prompt to emit.
 * @param format The requested format.
 */
public record OutputSpecNode(Token prompt, OutputFormat format) implements AstNode {

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.OUTPUT_SPEC;
    }

    @Override
    public SourcePosition position() {
        return prompt.position();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;

/**
 * A visitor over the Abstract Syntax Tree. Adding a node type adds an overload here,
 * so every visitor has to handle it.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    T visit(ProgramNode node);
    T visit(PromptDefNode node);
    T visit(VarDeclNode node);
    T visit(TemplateDefNode node);
    T visit(ConstraintDefNode node);
    T visit(ConstraintExprNode node);
    T visit(OutputSpecNode node);
    T visit(IdentifierNode node);
    T visit(StringLiteralNode node);
    T visit(NumberLiteralNode node);
    T visit(BooleanLiteralNode node);
    T visit(BinaryExprNode node);
    T visit(UnaryExprNode node);
    T visit(VariableRefNode node);
    T visit(CallNode node);
    T visit(IfNode node);
    T visit(ForNode node);
    T visit(WhileNode node);
    T visit(TextElementNode node);
    T visit(ListNode node);
    T visit(EmptyNode node);
}

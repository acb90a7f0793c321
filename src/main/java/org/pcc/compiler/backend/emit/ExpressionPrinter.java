package org.pcc.compiler.backend.emit;

import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.util.DepthGuard;

import java.util.stream.Collectors;

/**
 * Prints expressions back in source syntax, e.g. {@code ($a + 1) * 2} or {@code @greet("Bob")}.
 * Nested binary operands are parenthesized so the result parses to the same tree.
 * Statement nodes are not expressions and print as their kind name.
 * <p>
 * Every printed node counts against the {@link DepthGuard} of the emitter that owns the printer.
 */
final class ExpressionPrinter implements AstVisitor<String> {

    private final DepthGuard depthGuard;

    ExpressionPrinter(DepthGuard depthGuard) {
        this.depthGuard = depthGuard;
    }

    /**
     * @param node The expression to print.
     * @return The expression in source syntax.
     * @throws org.pcc.compiler.util.ResourceLimitException if the expression nests too deeply.
     */
    String print(AstNode node) {
        depthGuard.enter(node.position());
        try {
            return node.accept(this);
        } finally {
            depthGuard.exit();
        }
    }

    private String operand(AstNode node) {
        String printed = print(node);
        return node.kind() == AstNodeKind.BINARY_EXPR ? "(" + printed + ")" : printed;
    }

    private String joined(ListNode list) {
        return list.elements().stream().map(this::print).collect(Collectors.joining(", "));
    }

    @Override
    public String visit(IdentifierNode node) {
        return node.name();
    }

    @Override
    public String visit(StringLiteralNode node) {
        return "\"" + node.value() + "\"";
    }

    @Override
    public String visit(NumberLiteralNode node) {
        return NumberText.format(node.value());
    }

    @Override
    public String visit(BooleanLiteralNode node) {
        return Boolean.toString(node.value());
    }

    @Override
    public String visit(BinaryExprNode node) {
        return operand(node.left()) + " " + node.operator().symbol() + " " + operand(node.right());
    }

    @Override
    public String visit(UnaryExprNode node) {
        String separator = node.operator() == Operator.NOT ? " " : "";
        return node.operator().symbol() + separator + operand(node.operand());
    }

    @Override
    public String visit(VariableRefNode node) {
        return "$" + node.name();
    }

    @Override
    public String visit(CallNode node) {
        return (node.template() ? "@" : "") + node.name() + "(" + joined(node.arguments()) + ")";
    }

    @Override
    public String visit(ListNode node) {
        return "[" + joined(node) + "]";
    }

    @Override
    public String visit(EmptyNode node) {
        return "";
    }

    @Override
    public String visit(TextElementNode node) {
        return node.text();
    }

    @Override
    public String visit(ConstraintExprNode node) {
        return node.subject().text() + " " + node.operator().symbol() + " " + print(node.value());
    }

    // Statements never occur inside expressions.

    @Override
    public String visit(ProgramNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(PromptDefNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(VarDeclNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(TemplateDefNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(ConstraintDefNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(OutputSpecNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(IfNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(ForNode node) {
        return node.kind().name();
    }

    @Override
    public String visit(WhileNode node) {
        return node.kind().name();
    }
}

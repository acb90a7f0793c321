package org.pcc.compiler.backend.emit;

import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;
import org.pcc.compiler.util.DepthGuard;

/**
 * Renders the program as plain text: the prompt definitions with their literal text verbatim,
 * {@code $name} for references and {@code @name(args)} for calls. Conditionals and loops are
 * kept as {@code {{IF ...}}...{{END}}} markers.
 * <p>
 * Every top-level statement is followed by the statement separator, but only PROMPT
 * definitions produce content. VAR, TEMPLATE and CONSTRAINT declarations and the OUTPUT
 * specifications describe the prompt and are not part of its text.
 * <p>
 * The protected hooks define the decoration; {@link MarkdownEmitter} overrides them.
 */
public class TextEmitter implements IFormatEmitter {

    private final int maxNestingDepth;

    public TextEmitter(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public String emit(AstNode root, SymbolTable symbolTable) {
        Writer writer = new Writer(new DepthGuard(getClass().getSimpleName(), maxNestingDepth));
        writer.node(root);
        return writer.out.toString();
    }

    // region Decoration hooks

    protected String statementSeparator() {
        return "\n";
    }

    protected String promptHeader(String name) {
        return "Prompt: " + name + "\n";
    }

    /**
     * Wraps inline source syntax: references, calls and expressions.
     */
    protected String code(String source) {
        return source;
    }

    // endregion

    private final class Writer implements AstVisitor<Void> {

        private final StringBuilder out = new StringBuilder();
        private final DepthGuard depthGuard;
        private final ExpressionPrinter printer;

        Writer(DepthGuard depthGuard) {
            this.depthGuard = depthGuard;
            this.printer = new ExpressionPrinter(depthGuard);
        }

        void node(AstNode node) {
            depthGuard.enter(node.position());
            try {
                node.accept(this);
            } finally {
                depthGuard.exit();
            }
        }

        @Override
        public Void visit(ProgramNode node) {
            for (AstNode statement : node.statements().elements()) {
                node(statement);
                out.append(statementSeparator());
            }
            return null;
        }

        @Override
        public Void visit(PromptDefNode node) {
            out.append(promptHeader(node.name().text()));
            node(node.body());
            return null;
        }

        // Declarations contribute no text.

        @Override
        public Void visit(VarDeclNode node) {
            return null;
        }

        @Override
        public Void visit(TemplateDefNode node) {
            return null;
        }

        @Override
        public Void visit(ConstraintDefNode node) {
            return null;
        }

        @Override
        public Void visit(ConstraintExprNode node) {
            return null;
        }

        @Override
        public Void visit(OutputSpecNode node) {
            return null;
        }

        @Override
        public Void visit(TextElementNode node) {
            out.append(node.text());
            return null;
        }

        @Override
        public Void visit(VariableRefNode node) {
            out.append(code(printer.print(node)));
            return null;
        }

        @Override
        public Void visit(CallNode node) {
            out.append(code(printer.print(node)));
            return null;
        }

        @Override
        public Void visit(IfNode node) {
            out.append("{{IF ").append(printer.print(node.condition())).append("}}");
            node(node.thenBranch());
            if (node.hasElse()) {
                out.append("{{ELSE}}");
                node(node.elseBranch());
            }
            out.append("{{END}}");
            return null;
        }

        @Override
        public Void visit(ForNode node) {
            out.append("{{FOR ").append(node.variable()).append(" IN ")
                    .append(printer.print(node.iterable())).append("}}");
            node(node.body());
            out.append("{{END}}");
            return null;
        }

        @Override
        public Void visit(WhileNode node) {
            out.append("{{WHILE ").append(printer.print(node.condition())).append("}}");
            node(node.body());
            out.append("{{END}}");
            return null;
        }

        @Override
        public Void visit(ListNode node) {
            if (node.kind() == AstNodeKind.EXPRESSION_LIST) {
                out.append(code(printer.print(node)));
                return null;
            }
            for (AstNode element : node.elements()) {
                node(element);
            }
            return null;
        }

        @Override
        public Void visit(EmptyNode node) {
            return null;
        }

        // Bare expressions only appear here when a single expression is rendered.

        @Override
        public Void visit(IdentifierNode node) {
            return expression(node);
        }

        @Override
        public Void visit(StringLiteralNode node) {
            out.append(node.value());
            return null;
        }

        @Override
        public Void visit(NumberLiteralNode node) {
            return expression(node);
        }

        @Override
        public Void visit(BooleanLiteralNode node) {
            return expression(node);
        }

        @Override
        public Void visit(BinaryExprNode node) {
            return expression(node);
        }

        @Override
        public Void visit(UnaryExprNode node) {
            return expression(node);
        }

        private Void expression(AstNode node) {
            out.append(code(printer.print(node)));
            return null;
        }
    }
}

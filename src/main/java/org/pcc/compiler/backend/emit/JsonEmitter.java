package org.pcc.compiler.backend.emit;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;
import org.pcc.compiler.util.DepthGuard;

import java.util.List;

/**
 * Renders the AST as compact JSON. Every node becomes an object tagged with {@code "type"};
 * child nodes become nested objects and lists become arrays.
 * <p>
 * In {@link JsonEscaping#RAW} mode strings are written between quotes exactly as they are,
 * so text containing quotes, backslashes or control characters yields invalid JSON.
 * {@link JsonEscaping#ESCAPED} mode escapes them and writes non-finite numbers as {@code null}.
 */
public class JsonEmitter implements IFormatEmitter {

    private final JsonEscaping escaping;
    private final int maxNestingDepth;

    /**
     * @param escaping How to embed strings.
     * @param maxNestingDepth The deepest AST nesting accepted.
     */
    public JsonEmitter(JsonEscaping escaping, int maxNestingDepth) {
        this.escaping = escaping;
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public String emit(AstNode root, SymbolTable symbolTable) {
        Writer writer = new Writer(new DepthGuard("json emitter", maxNestingDepth));
        writer.node(root);
        return writer.out.toString();
    }

    private final class Writer implements AstVisitor<Void> {

        private final StringBuilder out = new StringBuilder();
        private final DepthGuard depthGuard;

        Writer(DepthGuard depthGuard) {
            this.depthGuard = depthGuard;
        }

        void node(AstNode node) {
            if (node == null) {
                out.append("null");
                return;
            }
            depthGuard.enter(node.position());
            try {
                node.accept(this);
            } finally {
                depthGuard.exit();
            }
        }

        private void string(String value) {
            out.append('"');
            if (escaping == JsonEscaping.ESCAPED) {
                JsonStringEncoder.getInstance().quoteAsString(value, out);
            } else {
                out.append(value);
            }
            out.append('"');
        }

        private void number(double value) {
            if (escaping == JsonEscaping.ESCAPED && (Double.isNaN(value) || Double.isInfinite(value))) {
                out.append("null");
            } else {
                out.append(NumberText.format(value));
            }
        }

        private void type(String type) {
            out.append("{\"type\":");
            string(type);
        }

        private void key(String key) {
            out.append(',');
            string(key);
            out.append(':');
        }

        private void stringField(String key, String value) {
            key(key);
            string(value);
        }

        private void nodeField(String key, AstNode value) {
            key(key);
            node(value);
        }

        private void array(List<AstNode> elements) {
            out.append('[');
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) out.append(',');
                node(elements.get(i));
            }
            out.append(']');
        }

        private void end() {
            out.append('}');
        }

        @Override
        public Void visit(ProgramNode node) {
            type("program");
            key("statements");
            array(node.statements().elements());
            key("outputs");
            array(node.outputs().elements());
            end();
            return null;
        }

        @Override
        public Void visit(PromptDefNode node) {
            type("prompt_def");
            stringField("name", node.name().text());
            nodeField("body", node.body());
            end();
            return null;
        }

        @Override
        public Void visit(VarDeclNode node) {
            type("var_decl");
            stringField("name", node.name().text());
            nodeField("value", node.initializer());
            end();
            return null;
        }

        @Override
        public Void visit(TemplateDefNode node) {
            type("template_def");
            stringField("name", node.name().text());
            key("parameters");
            out.append('[');
            List<String> names = node.parameterNames();
            for (int i = 0; i < names.size(); i++) {
                if (i > 0) out.append(',');
                string(names.get(i));
            }
            out.append(']');
            nodeField("body", node.body());
            end();
            return null;
        }

        @Override
        public Void visit(ConstraintDefNode node) {
            type("constraint_def");
            stringField("name", node.name().text());
            nodeField("constraints", node.constraints());
            end();
            return null;
        }

        @Override
        public Void visit(ConstraintExprNode node) {
            type("constraint");
            stringField("subject", node.subject().text());
            stringField("operator", node.operator().symbol());
            nodeField("value", node.value());
            end();
            return null;
        }

        @Override
        public Void visit(OutputSpecNode node) {
            type("output_spec");
            stringField("prompt", node.prompt().text());
            stringField("format", node.format().name());
            end();
            return null;
        }

        @Override
        public Void visit(IdentifierNode node) {
            type("identifier");
            stringField("name", node.name());
            end();
            return null;
        }

        @Override
        public Void visit(StringLiteralNode node) {
            type("string");
            stringField("value", node.value());
            end();
            return null;
        }

        @Override
        public Void visit(NumberLiteralNode node) {
            type("number");
            key("value");
            number(node.value());
            end();
            return null;
        }

        @Override
        public Void visit(BooleanLiteralNode node) {
            type("boolean");
            key("value");
            out.append(node.value());
            end();
            return null;
        }

        @Override
        public Void visit(BinaryExprNode node) {
            type("binary");
            stringField("operator", node.operator().symbol());
            nodeField("left", node.left());
            nodeField("right", node.right());
            end();
            return null;
        }

        @Override
        public Void visit(UnaryExprNode node) {
            type("unary");
            stringField("operator", node.operator().symbol());
            nodeField("operand", node.operand());
            end();
            return null;
        }

        @Override
        public Void visit(VariableRefNode node) {
            type("variable_ref");
            stringField("name", node.name());
            end();
            return null;
        }

        @Override
        public Void visit(CallNode node) {
            type(node.kind().jsonName());
            stringField("name", node.name());
            key("arguments");
            array(node.arguments().elements());
            end();
            return null;
        }

        @Override
        public Void visit(IfNode node) {
            type("if");
            nodeField("condition", node.condition());
            nodeField("then", node.thenBranch());
            nodeField("else", node.elseBranch());
            end();
            return null;
        }

        @Override
        public Void visit(ForNode node) {
            type("for");
            stringField("variable", node.variable());
            nodeField("iterable", node.iterable());
            nodeField("body", node.body());
            end();
            return null;
        }

        @Override
        public Void visit(WhileNode node) {
            type("while");
            nodeField("condition", node.condition());
            nodeField("body", node.body());
            end();
            return null;
        }

        @Override
        public Void visit(TextElementNode node) {
            type("text");
            stringField("text", node.text());
            key("raw");
            out.append(node.raw());
            end();
            return null;
        }

        @Override
        public Void visit(ListNode node) {
            type(node.kind().jsonName());
            key("elements");
            array(node.elements());
            end();
            return null;
        }

        @Override
        public Void visit(EmptyNode node) {
            // No dedicated shape; only the kind is reported.
            type(node.kind().name());
            end();
            return null;
        }
    }
}

package org.pcc.compiler.optimizer;

import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.util.DepthGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Rewrites the AST bottom-up: operands are optimized before the node that holds them.
 * <p>
 * Constant folding evaluates arithmetic on two number literals and the negation of a
 * single literal. Dead-code elimination replaces an IF with a boolean-literal condition
 * by the branch it would take, or by an {@link EmptyNode} which list containers drop.
 * List slots are replaced in place; other nodes are rebuilt when a child changed.
 * <p>
 * Unless {@code descendIntoDefinitions} is set, PROMPT, VAR, TEMPLATE, CONSTRAINT, OUTPUT,
 * FOR and WHILE subtrees are passed through untouched.
 */
public class Optimizer implements AstVisitor<AstNode> {

    private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

    private final boolean folding;
    private final boolean deadCodeElimination;
    private final boolean descendIntoDefinitions;
    private final int maxNestingDepth;
    private DepthGuard depthGuard;
    private int rewrites;

    /**
     * Creates an optimizer with the default coverage and nesting limit.
     * @param passes The requested passes.
     */
    public Optimizer(Set<OptimizationPass> passes) {
        this(passes, false, CompilerOptions.defaults().maxNestingDepth());
    }

    /**
     * @param passes The requested passes; {@link OptimizationPass#ALL} enables every implemented one.
     * @param descendIntoDefinitions Whether to optimize inside declarations and loops.
     * @param maxNestingDepth The deepest AST nesting accepted.
     */
    public Optimizer(Set<OptimizationPass> passes, boolean descendIntoDefinitions, int maxNestingDepth) {
        Set<OptimizationPass> requested = passes.isEmpty() ? EnumSet.noneOf(OptimizationPass.class) : EnumSet.copyOf(passes);
        this.folding = OptimizationPass.CONSTANT_FOLDING.isEnabledIn(requested);
        this.deadCodeElimination = OptimizationPass.DEAD_CODE_ELIMINATION.isEnabledIn(requested);
        this.descendIntoDefinitions = descendIntoDefinitions;
        this.maxNestingDepth = maxNestingDepth;
        if (requested.contains(OptimizationPass.UNUSED_REMOVAL) || requested.contains(OptimizationPass.INLINE_TEMPLATES)) {
            LOG.debug("Reserved optimization passes requested and ignored: {}", requested);
        }
    }

    /**
     * Optimizes a tree.
     * @param root The root; a {@link ProgramNode} is updated in place and returned.
     * @return The rewritten root and the number of rewrites.
     * @throws org.pcc.compiler.util.ResourceLimitException if the tree nests too deeply.
     */
    public OptimizationResult optimize(AstNode root) {
        rewrites = 0;
        depthGuard = new DepthGuard("optimizer", maxNestingDepth);
        AstNode result = rewrite(root);
        LOG.debug("Optimizer applied {} rewrites", rewrites);
        return new OptimizationResult(result, rewrites);
    }

    private AstNode rewrite(AstNode node) {
        depthGuard.enter(node.position());
        try {
            return node.accept(this);
        } finally {
            depthGuard.exit();
        }
    }

    private void rewriteSlots(ListNode list) {
        for (int i = 0; i < list.size(); i++) {
            AstNode before = list.get(i);
            AstNode after = rewrite(before);
            if (after != before) {
                list.set(i, after);
            }
        }
        list.removeEmpty();
    }

    // region Containers

    @Override
    public AstNode visit(ProgramNode node) {
        rewriteSlots(node.statements());
        rewriteSlots(node.outputs());
        return node;
    }

    @Override
    public AstNode visit(ListNode node) {
        rewriteSlots(node);
        return node;
    }

    // endregion

    // region Declarations and loops

    @Override
    public AstNode visit(PromptDefNode node) {
        if (descendIntoDefinitions) {
            rewriteSlots(node.body());
        }
        return node;
    }

    @Override
    public AstNode visit(VarDeclNode node) {
        if (!descendIntoDefinitions) {
            return node;
        }
        AstNode initializer = rewrite(node.initializer());
        return initializer == node.initializer() ? node : new VarDeclNode(node.name(), initializer);
    }

    @Override
    public AstNode visit(TemplateDefNode node) {
        if (descendIntoDefinitions) {
            rewriteSlots(node.body());
        }
        return node;
    }

    @Override
    public AstNode visit(ConstraintDefNode node) {
        if (descendIntoDefinitions) {
            rewriteSlots(node.constraints());
        }
        return node;
    }

    @Override
    public AstNode visit(ConstraintExprNode node) {
        AstNode value = rewrite(node.value());
        return value == node.value() ? node : new ConstraintExprNode(node.subject(), node.operator(), value);
    }

    @Override
    public AstNode visit(OutputSpecNode node) {
        return node;
    }

    @Override
    public AstNode visit(ForNode node) {
        if (!descendIntoDefinitions) {
            return node;
        }
        AstNode iterable = rewrite(node.iterable());
        rewriteSlots(node.body());
        return iterable == node.iterable()
                ? node
                : new ForNode(node.variable(), node.variablePosition(), iterable, node.body(), node.position());
    }

    @Override
    public AstNode visit(WhileNode node) {
        if (!descendIntoDefinitions) {
            return node;
        }
        AstNode condition = rewrite(node.condition());
        rewriteSlots(node.body());
        return condition == node.condition() ? node : new WhileNode(condition, node.body(), node.position());
    }

    // endregion

    // region Expressions

    @Override
    public AstNode visit(BinaryExprNode node) {
        AstNode left = rewrite(node.left());
        AstNode right = rewrite(node.right());
        if (folding && left instanceof NumberLiteralNode a && right instanceof NumberLiteralNode b) {
            Double folded = fold(node.operator(), a.value(), b.value());
            if (folded != null) {
                rewrites++;
                return new NumberLiteralNode(folded, left.position());
            }
        }
        if (left == node.left() && right == node.right()) {
            return node;
        }
        return new BinaryExprNode(node.operator(), left, right, node.position());
    }

    /**
     * Evaluates {@code a op b}, or returns null if the operator does not fold or the
     * result would be a division or remainder by zero.
     */
    static Double fold(Operator operator, double a, double b) {
        switch (operator) {
            case ADD: return a + b;
            case SUBTRACT: return a - b;
            case MULTIPLY: return a * b;
            case DIVIDE: return b == 0.0 ? null : a / b;
            case MODULO: return b == 0.0 ? null : a % b;
            case POWER: return Math.pow(a, b);
            default: return null;
        }
    }

    @Override
    public AstNode visit(UnaryExprNode node) {
        AstNode operand = rewrite(node.operand());
        if (folding) {
            if (node.operator() == Operator.NEGATE && operand instanceof NumberLiteralNode n) {
                rewrites++;
                return new NumberLiteralNode(-n.value(), node.position());
            }
            if (node.operator().isLogicalNegation() && operand instanceof BooleanLiteralNode b) {
                rewrites++;
                return new BooleanLiteralNode(!b.value(), node.position());
            }
        }
        return operand == node.operand() ? node : new UnaryExprNode(node.operator(), operand, node.position());
    }

    @Override
    public AstNode visit(CallNode node) {
        rewriteSlots(node.arguments());
        return node;
    }

    @Override
    public AstNode visit(IdentifierNode node) {
        return node;
    }

    @Override
    public AstNode visit(StringLiteralNode node) {
        return node;
    }

    @Override
    public AstNode visit(NumberLiteralNode node) {
        return node;
    }

    @Override
    public AstNode visit(BooleanLiteralNode node) {
        return node;
    }

    @Override
    public AstNode visit(VariableRefNode node) {
        return node;
    }

    // endregion

    // region Control flow and elements

    @Override
    public AstNode visit(IfNode node) {
        AstNode condition = rewrite(node.condition());
        rewriteSlots(node.thenBranch());
        AstNode elseBranch = node.elseBranch() == null ? null : rewrite(node.elseBranch());
        if (elseBranch != null && elseBranch.kind() == AstNodeKind.EMPTY) {
            elseBranch = null;
        }

        if (deadCodeElimination && condition instanceof BooleanLiteralNode literal) {
            rewrites++;
            if (literal.value()) {
                return node.thenBranch();
            }
            return elseBranch != null ? elseBranch : new EmptyNode(node.position());
        }
        if (condition == node.condition() && elseBranch == node.elseBranch()) {
            return node;
        }
        return new IfNode(condition, node.thenBranch(), elseBranch, node.position());
    }

    @Override
    public AstNode visit(TextElementNode node) {
        return node;
    }

    @Override
    public AstNode visit(EmptyNode node) {
        return node;
    }

    // endregion
}

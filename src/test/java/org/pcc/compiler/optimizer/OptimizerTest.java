package org.pcc.compiler.optimizer;

import org.pcc.compiler.frontend.lexer.Lexer;
import org.pcc.compiler.frontend.parser.ParseResult;
import org.pcc.compiler.frontend.parser.Parser;
import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Optimizer}.
 */
public class OptimizerTest {

    private static ProgramNode parse(String source) {
        ParseResult parsed = new Parser(new Lexer(source).scanTokens().tokens()).parse();
        assertThat(parsed.errors()).isEmpty();
        return parsed.program();
    }

    private static AstNode expression(String expression) {
        return ((VarDeclNode) parse("VAR x = " + expression + ";").statements().get(0)).initializer();
    }

    private static AstNode firstElement(String promptBody) {
        ProgramNode program = parse("PROMPT p { " + promptBody + " }");
        return ((PromptDefNode) program.statements().get(0)).body().get(0);
    }

    /**
     * Verifies that nested arithmetic on literals folds to a single number.
     */
    @Test
    @Tag("unit")
    void testArithmeticFolding() {
        // Arrange
        AstNode expr = expression("1 + 2 * 3 - 2 ^ 2");

        // Act
        OptimizationResult result = new Optimizer(OptimizationPass.all()).optimize(expr);

        // Assert
        assertThat(result.root()).isInstanceOf(NumberLiteralNode.class);
        assertThat(((NumberLiteralNode) result.root()).value()).isEqualTo(3.0);
        assertThat(result.rewrites()).isEqualTo(4);
        // A folded node takes the position of its leftmost operand.
        assertThat(result.root().position().column()).isEqualTo(9);
    }

    /**
     * Verifies that arithmetic is only folded when both operands are numbers.
     */
    @Test
    @Tag("unit")
    void testNonNumericOperandsAreNotFolded() {
        // Arrange
        Optimizer optimizer = new Optimizer(OptimizationPass.all());
        AstNode strings = expression("\"a\" + \"b\"");
        AstNode mixed = expression("true + 1");

        // Act
        OptimizationResult stringsResult = optimizer.optimize(strings);
        OptimizationResult mixedResult = optimizer.optimize(mixed);

        // Assert
        assertThat(strings).isInstanceOf(BinaryExprNode.class);
        assertThat(mixed).isInstanceOf(BinaryExprNode.class);
        assertThat(stringsResult.root()).isSameAs(strings);
        assertThat(mixedResult.root()).isSameAs(mixed);
        assertThat(stringsResult.rewrites()).isZero();
        assertThat(mixedResult.rewrites()).isZero();
    }

    /**
     * Verifies that division and remainder by zero are left for a later stage.
     */
    @Test
    @Tag("unit")
    void testDivisionByZeroIsNotFolded() {
        // Arrange
        AstNode division = expression("1 + 10 / 0");
        AstNode remainder = expression("7 % 0");

        // Act
        OptimizationResult divided = new Optimizer(OptimizationPass.all()).optimize(division);
        OptimizationResult remaindered = new Optimizer(OptimizationPass.all()).optimize(remainder);

        // Assert
        assertThat(divided.root()).isSameAs(division);
        assertThat(remaindered.root()).isSameAs(remainder);
        assertThat(divided.rewrites() + remaindered.rewrites()).isZero();
        assertThat(Optimizer.fold(Operator.DIVIDE, 1, 0)).isNull();
        assertThat(Optimizer.fold(Operator.MODULO, 7, 3)).isEqualTo(1.0);
        assertThat(Optimizer.fold(Operator.LESS, 1, 2)).isNull();
    }

    /**
     * Verifies unary folding and partial folding next to non-constant operands.
     */
    @Test
    @Tag("unit")
    void testUnaryAndPartialFolding() {
        // Arrange
        Optimizer optimizer = new Optimizer(OptimizationPass.all());

        // Act
        AstNode negated = optimizer.optimize(expression("-(2 + 3)")).root();
        AstNode not = optimizer.optimize(expression("NOT true")).root();
        AstNode bang = optimizer.optimize(expression("!false")).root();
        AstNode partial = optimizer.optimize(expression("$x + 2 * 3")).root();
        AstNode untouched = expression("NOT $x");
        OptimizationResult untouchedResult = optimizer.optimize(untouched);

        // Assert
        assertThat(((NumberLiteralNode) negated).value()).isEqualTo(-5.0);
        assertThat(((BooleanLiteralNode) not).value()).isFalse();
        assertThat(((BooleanLiteralNode) bang).value()).isTrue();
        BinaryExprNode sum = (BinaryExprNode) partial;
        assertThat(sum.left()).isInstanceOf(VariableRefNode.class);
        assertThat(((NumberLiteralNode) sum.right()).value()).isEqualTo(6.0);
        assertThat(untouchedResult.root()).isSameAs(untouched);
        assertThat(untouchedResult.rewrites()).isZero();
    }

    /**
     * Verifies that an IF with a literal condition is replaced by the branch it takes.
     */
    @Test
    @Tag("unit")
    void testDeadBranchElimination() {
        // Arrange
        IfNode taken = (IfNode) firstElement("IF true { \"yes\" } ELSE { \"no\" }");
        IfNode skipped = (IfNode) firstElement("IF false { \"never\" }");
        IfNode chain = (IfNode) firstElement("IF false { \"a\" } ELSE IF 1 == 1 { \"b\" } ELSE IF true { \"c\" }");

        // Act
        OptimizationResult takenResult = new Optimizer(OptimizationPass.all()).optimize(taken);
        OptimizationResult skippedResult = new Optimizer(OptimizationPass.all()).optimize(skipped);
        OptimizationResult chainResult = new Optimizer(OptimizationPass.all()).optimize(chain);

        // Assert
        assertThat(takenResult.root()).isSameAs(taken.thenBranch());
        assertThat(takenResult.rewrites()).isEqualTo(1);
        assertThat(skippedResult.root()).isInstanceOf(EmptyNode.class);
        assertThat(skippedResult.rewrites()).isEqualTo(1);
        // "1 == 1" does not fold, so the chain keeps its second IF.
        assertThat(chainResult.root()).isInstanceOf(IfNode.class);
        IfNode remaining = (IfNode) chainResult.root();
        assertThat(remaining.elseBranch().kind()).isEqualTo(AstNodeKind.ELEMENT_LIST);
        assertThat(chainResult.rewrites()).isEqualTo(2);
    }

    /**
     * Verifies that, by default, declarations are passed through and only descending rewrites them.
     */
    @Test
    @Tag("unit")
    void testDescendIntoDefinitions() {
        // Arrange
        String source = "VAR x = 1 + 2; PROMPT p { IF false { \"gone\" } \"kept\" IF true { \"inline\" } }";
        ProgramNode shallow = parse(source);
        ProgramNode deep = parse(source);

        // Act
        OptimizationResult shallowResult = new Optimizer(OptimizationPass.all()).optimize(shallow);
        OptimizationResult deepResult = new Optimizer(OptimizationPass.all(), true, 64).optimize(deep);

        // Assert
        assertThat(shallowResult.rewrites()).isZero();
        assertThat(((VarDeclNode) shallowResult.program().statements().get(0)).initializer())
                .isInstanceOf(BinaryExprNode.class);

        assertThat(deepResult.rewrites()).isEqualTo(3);
        ProgramNode program = deepResult.program();
        assertThat(program).isSameAs(deep);
        assertThat(((VarDeclNode) program.statements().get(0)).initializer())
                .isEqualTo(new NumberLiteralNode(3.0, ((VarDeclNode) program.statements().get(0)).initializer().position()));
        ListNode body = ((PromptDefNode) program.statements().get(1)).body();
        assertThat(body.elements()).extracting(AstNode::kind)
                .containsExactly(AstNodeKind.TEXT_ELEMENT, AstNodeKind.ELEMENT_LIST);
    }

    /**
     * Verifies that each pass runs only when requested.
     */
    @Test
    @Tag("unit")
    void testPassSelection() {
        // Arrange
        IfNode ifNode = (IfNode) firstElement("IF NOT false { \"x\" }");

        // Act
        OptimizationResult foldingOnly = new Optimizer(EnumSet.of(OptimizationPass.CONSTANT_FOLDING)).optimize(ifNode);
        OptimizationResult dceOnly = new Optimizer(EnumSet.of(OptimizationPass.DEAD_CODE_ELIMINATION))
                .optimize(expression("1 + 2"));

        // Assert
        assertThat(foldingOnly.root()).isInstanceOf(IfNode.class);
        assertThat(((IfNode) foldingOnly.root()).condition()).isEqualTo(
                new BooleanLiteralNode(true, ifNode.condition().position()));
        assertThat(foldingOnly.rewrites()).isEqualTo(1);
        assertThat(dceOnly.root()).isInstanceOf(BinaryExprNode.class);
        assertThat(dceOnly.rewrites()).isZero();
    }

    /**
     * Verifies that reserved passes and an empty pass set leave the tree unchanged.
     */
    @Test
    @Tag("unit")
    void testReservedAndEmptyPassSets() {
        // Arrange
        AstNode expr = expression("1 + 2");

        // Act
        OptimizationResult reserved = new Optimizer(
                Set.of(OptimizationPass.UNUSED_REMOVAL, OptimizationPass.INLINE_TEMPLATES)).optimize(expr);
        OptimizationResult none = new Optimizer(Set.of()).optimize(expr);

        // Assert
        assertThat(reserved.root()).isSameAs(expr);
        assertThat(none.root()).isSameAs(expr);
        assertThat(reserved.rewrites() + none.rewrites()).isZero();
        assertThatThrownBy(reserved::program).isInstanceOf(IllegalStateException.class);
    }
}

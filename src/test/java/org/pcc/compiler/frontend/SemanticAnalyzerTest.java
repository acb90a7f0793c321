package org.pcc.compiler.frontend;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.diagnostics.Diagnostic;
import org.pcc.compiler.frontend.lexer.Lexer;
import org.pcc.compiler.frontend.parser.ParseResult;
import org.pcc.compiler.frontend.parser.Parser;
import org.pcc.compiler.frontend.semantics.AnalysisResult;
import org.pcc.compiler.frontend.semantics.SemanticAnalyzer;
import org.pcc.compiler.frontend.semantics.SemanticError;
import org.pcc.compiler.frontend.semantics.SemanticErrorCode;
import org.pcc.compiler.frontend.semantics.SymbolKind;
import org.pcc.compiler.util.ResourceLimitException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * Programs are lexed and parsed from source so the tests read like the language they check.
 */
public class SemanticAnalyzerTest {

    private ParseResult parse(String source) {
        ParseResult parsed = new Parser(new Lexer(source, "test.pcc").scanTokens().tokens()).parse();
        assertThat(parsed.errors()).as("syntax errors in %s", source).isEmpty();
        return parsed;
    }

    private AnalysisResult analyze(String source) {
        return new SemanticAnalyzer().analyze(parse(source).program());
    }

    /**
     * Verifies that a well-formed program passes without errors or warnings.
     */
    @Test
    @Tag("unit")
    void testValidProgramHasNoFindings() {
        // Arrange
        String source = String.join("\n",
                "VAR greeting = \"Hi\";",
                "TEMPLATE sign(name) { \"-- $name\" }",
                "CONSTRAINT limits { max_tokens <= 500; }",
                "PROMPT p { \"$greeting\" @sign(\"me\") }",
                "OUTPUT p AS TEXT;");

        // Act
        AnalysisResult result = analyze(source);

        // Assert
        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.symbolTable().globalScope().symbols())
                .extracting(symbol -> symbol.name() + ":" + symbol.kind())
                .containsExactlyInAnyOrder("greeting:VARIABLE", "sign:TEMPLATE", "limits:CONSTRAINT", "p:PROMPT");
        assertThat(result.symbolTable().currentScope().isGlobal()).isTrue();
    }

    /**
     * Verifies that each unresolved reference yields exactly one error at the reference.
     */
    @Test
    @Tag("unit")
    void testUndefinedReferencesAreReportedOnce() {
        // Act
        AnalysisResult result = analyze("PROMPT p { \"Hi $who\" @missing }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message)
                .containsExactly("Undefined variable '$who'", "Undefined template 'missing'");
        assertThat(result.errors()).extracting(SemanticError::code)
                .containsOnly(SemanticErrorCode.UNDEFINED_SYMBOL);
        assertThat(result.errors().get(0).position()).isEqualTo(new SourcePosition(1, 16, "test.pcc"));
        assertThat(result.errors().get(1).position()).isEqualTo(new SourcePosition(1, 21, "test.pcc"));
    }

    /**
     * Verifies that a symbol of the wrong kind is rejected with a type mismatch.
     */
    @Test
    @Tag("unit")
    void testWrongSymbolKindIsTypeMismatch() {
        // Act
        AnalysisResult result = analyze("VAR t = 1; TEMPLATE x() { \"a\" } PROMPT p { $x @t }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message)
                .containsExactly("'$x' is not a variable", "'t' is not a template");
        assertThat(result.errors()).extracting(SemanticError::code)
                .containsOnly(SemanticErrorCode.TYPE_MISMATCH);
    }

    /**
     * Verifies that template calls must match the parameter count.
     */
    @Test
    @Tag("unit")
    void testTemplateArityIsChecked() {
        // Act
        AnalysisResult result = analyze(
                "TEMPLATE greet(a, b) { \"$a $b\" } PROMPT p { @greet(\"x\") @greet(1, 2, 3) @greet(1, 2) }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message).containsExactly(
                "Template 'greet' expects 2 argument(s) but got 1",
                "Template 'greet' expects 2 argument(s) but got 3");
        assertThat(result.errors()).extracting(SemanticError::code)
                .containsExactly(SemanticErrorCode.MISSING_ARGUMENT, SemanticErrorCode.TOO_MANY_ARGUMENTS);
    }

    /**
     * Verifies that OUTPUT specifications must name a declared prompt.
     */
    @Test
    @Tag("unit")
    void testOutputMustNamePrompt() {
        // Act
        AnalysisResult result = analyze("VAR v = 1; OUTPUT v AS TEXT; OUTPUT nowhere AS JSON;");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message).containsExactly(
                "'v' is not a prompt in OUTPUT specification",
                "Undefined prompt 'nowhere' in OUTPUT specification");
    }

    /**
     * Verifies that OUTPUT may name a prompt declared after it.
     */
    @Test
    @Tag("unit")
    void testOutputMayPrecedePrompt() {
        // Act
        AnalysisResult result = analyze("OUTPUT late AS MARKDOWN; PROMPT late { \"x\" }");

        // Assert
        assertThat(result.errors()).isEmpty();
    }

    /**
     * Verifies that templates must be declared before the prompts that call them.
     */
    @Test
    @Tag("unit")
    void testTemplatesResolveInDeclarationOrder() {
        // Act
        AnalysisResult result = analyze("PROMPT p { @later } TEMPLATE later() { \"x\" }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message)
                .containsExactly("Undefined template 'later'");
    }

    /**
     * Verifies that a template parameter may shadow a global variable.
     */
    @Test
    @Tag("unit")
    void testParameterShadowsGlobal() {
        // Act
        AnalysisResult result = analyze(
                "VAR name = \"global\"; TEMPLATE t(name) { \"$name\" } PROMPT p { $name @t(\"x\") }");

        // Assert
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.symbolTable().allScopes()).hasSize(2);
        assertThat(result.symbolTable().allScopes().get(1).symbols())
                .extracting(symbol -> symbol.kind()).containsExactly(SymbolKind.PARAMETER);
    }

    /**
     * Verifies that a duplicate declaration in the same scope is reported once, at the duplicate.
     */
    @Test
    @Tag("unit")
    void testRedefinitionIsReported() {
        // Act
        AnalysisResult result = analyze("VAR a = 1;\nVAR a = 2;\nPROMPT p { $a }");

        // Assert
        assertThat(result.errors()).hasSize(1);
        SemanticError error = result.errors().get(0);
        assertThat(error.code()).isEqualTo(SemanticErrorCode.REDEFINED_SYMBOL);
        assertThat(error.message()).isEqualTo("Symbol 'a' already defined in this scope");
        assertThat(error.position().line()).isEqualTo(2);
        assertThat(error.position().column()).isEqualTo(5);
    }

    /**
     * Verifies that a FOR loop variable is visible only inside the loop.
     */
    @Test
    @Tag("unit")
    void testLoopVariableIsScopedToLoop() {
        // Act
        AnalysisResult result = analyze("PROMPT p { FOR item IN [1, 2] { $item } $item }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message)
                .containsExactly("Undefined variable '$item'");
        assertThat(result.symbolTable().allScopes()).hasSize(2);
    }

    /**
     * Verifies that bare identifiers and the callee of a plain call must resolve.
     */
    @Test
    @Tag("unit")
    void testIdentifiersAndFunctionCalls() {
        // Act
        AnalysisResult result = analyze("VAR a = upper(b); PROMPT p { $a }");

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message)
                .containsExactly("Undefined template 'upper'", "Undefined identifier 'b'");
    }

    /**
     * Verifies that plain calls resolve against templates exactly like '@' calls.
     */
    @Test
    @Tag("unit")
    void testPlainCallsResolveAgainstTemplates() {
        // Arrange
        String source = String.join("\n",
                "TEMPLATE wrap(x) { \"[$x]\" }",
                "VAR v = wrap(1, 2);",
                "VAR w = v(1);",
                "PROMPT p { IF nope(2) { \"a\" } $v $w }");

        // Act
        AnalysisResult result = analyze(source);

        // Assert
        assertThat(result.errors()).extracting(SemanticError::message).containsExactly(
                "Template 'wrap' expects 1 argument(s) but got 2",
                "'v' is not a template",
                "Undefined template 'nope'");
        assertThat(result.errors()).extracting(SemanticError::code).containsExactly(
                SemanticErrorCode.TOO_MANY_ARGUMENTS,
                SemanticErrorCode.TYPE_MISMATCH,
                SemanticErrorCode.UNDEFINED_SYMBOL);
    }

    /**
     * Verifies that unused variables and parameters produce warnings, not errors.
     */
    @Test
    @Tag("unit")
    void testUnusedSymbolsAreWarnings() {
        // Act
        AnalysisResult result = analyze("VAR unused = 1; TEMPLATE t(p1) { \"static\" } PROMPT p { @t(1) }");

        // Assert
        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::type).containsOnly(Diagnostic.Type.WARNING);
        assertThat(result.warnings()).extracting(Diagnostic::message)
                .containsExactly("Variable 'unused' is never used", "Parameter 'p1' is never used");
    }

    /**
     * Verifies that deeply nested trees are rejected instead of overflowing the stack.
     */
    @Test
    @Tag("unit")
    void testNestingLimit() {
        // Arrange
        ParseResult parsed = parse("VAR x = " + "-".repeat(10) + "1; PROMPT p { $x }");

        // Act & Assert
        assertThatThrownBy(() -> new SemanticAnalyzer(5).analyze(parsed.program()))
                .isInstanceOf(ResourceLimitException.class)
                .hasMessageContaining("semantic analysis");
    }
}

package org.pcc.compiler.backend.emit;

import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.frontend.lexer.Lexer;
import org.pcc.compiler.frontend.parser.ParseResult;
import org.pcc.compiler.frontend.parser.Parser;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.BinaryExprNode;
import org.pcc.compiler.frontend.parser.ast.EmptyNode;
import org.pcc.compiler.frontend.parser.ast.IfNode;
import org.pcc.compiler.frontend.parser.ast.NumberLiteralNode;
import org.pcc.compiler.frontend.parser.ast.Operator;
import org.pcc.compiler.frontend.parser.ast.ProgramNode;
import org.pcc.compiler.frontend.parser.ast.VariableRefNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.util.ResourceLimitException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link CodeGenerator} and its emitters.
 */
public class CodeGeneratorTest {

    private static final SourcePosition POS = new SourcePosition(1, 1, "test.pcc");

    private static final String PROGRAM = String.join("\n",
            "VAR greeting = \"Hi\";",
            "TEMPLATE sign(name) { \"-- $name\" }",
            "CONSTRAINT c { max_tokens <= 500; }",
            "PROMPT p { \"$greeting, world \" @sign(\"me\") IF $formal { \"Sir\" } ELSE { \"pal\" } }",
            "OUTPUT p AS TEXT;");

    private static ProgramNode parse(String source) {
        ParseResult parsed = new Parser(new Lexer(source, "test.pcc").scanTokens().tokens()).parse();
        assertThat(parsed.errors()).isEmpty();
        return parsed.program();
    }

    private static String generate(String source, OutputFormat format) {
        return new CodeGenerator().generate(parse(source), format, null);
    }

    /**
     * Verifies the JSON shape of a small program, including the separate outputs list.
     */
    @Test
    @Tag("unit")
    void testJsonProgramShape() {
        // Act
        String json = generate("VAR greeting = \"Hi\"; PROMPT p { \"$greeting, world\" } OUTPUT p AS JSON;",
                OutputFormat.JSON);

        // Assert
        assertThat(json).isEqualTo("{\"type\":\"program\",\"statements\":["
                + "{\"type\":\"var_decl\",\"name\":\"greeting\",\"value\":{\"type\":\"string\",\"value\":\"Hi\"}},"
                + "{\"type\":\"prompt_def\",\"name\":\"p\",\"body\":{\"type\":\"element_list\",\"elements\":["
                + "{\"type\":\"variable_ref\",\"name\":\"greeting\"},"
                + "{\"type\":\"text\",\"text\":\", world\",\"raw\":false}]}}],"
                + "\"outputs\":[{\"type\":\"output_spec\",\"prompt\":\"p\",\"format\":\"JSON\"}]}");
    }

    /**
     * Verifies JSON for control flow, calls and numbers.
     */
    @Test
    @Tag("unit")
    void testJsonExpressionsAndControlFlow() {
        // Act
        String json = generate("TEMPLATE t(a) { IF $a > 2.5 { @t(3) } }", OutputFormat.JSON);

        // Assert
        assertThat(json).contains("{\"type\":\"template_def\",\"name\":\"t\",\"parameters\":[\"a\"],");
        assertThat(json).contains("{\"type\":\"if\",\"condition\":{\"type\":\"binary\",\"operator\":\">\","
                + "\"left\":{\"type\":\"variable_ref\",\"name\":\"a\"},"
                + "\"right\":{\"type\":\"number\",\"value\":2.5}},");
        assertThat(json).contains("{\"type\":\"template_call\",\"name\":\"t\",\"arguments\":[{\"type\":\"number\",\"value\":3}]}");
        assertThat(json).contains("\"else\":null}");
    }

    /**
     * Verifies that RAW embeds strings verbatim while ESCAPED produces valid JSON literals.
     */
    @Test
    @Tag("unit")
    void testJsonEscapingModes() {
        // Arrange
        ProgramNode program = parse("PROMPT q { 'say \"hi\"' }");
        CodeGenerator escaped = new CodeGenerator(CompilerOptions.defaults().withJsonEscaping(JsonEscaping.ESCAPED));

        // Act
        String rawJson = new CodeGenerator().generate(program, OutputFormat.JSON, null);
        String escapedJson = escaped.generate(program, OutputFormat.JSON, null);

        // Assert
        assertThat(rawJson).contains("\"text\":\"say \"hi\"\"");
        assertThat(escapedJson).contains("\"text\":\"say \\\"hi\\\"\"");
    }

    /**
     * Verifies nodes without a dedicated JSON shape and non-finite numbers.
     */
    @Test
    @Tag("unit")
    void testJsonFallbacks() {
        // Arrange
        CodeGenerator raw = new CodeGenerator();
        CodeGenerator escaped = new CodeGenerator(CompilerOptions.defaults().withJsonEscaping(JsonEscaping.ESCAPED));
        NumberLiteralNode infinite = new NumberLiteralNode(Double.POSITIVE_INFINITY, POS);

        // Act & Assert
        assertThat(raw.generate(new EmptyNode(POS), OutputFormat.JSON, null)).isEqualTo("{\"type\":\"EMPTY\"}");
        assertThat(raw.generate(infinite, OutputFormat.JSON, null)).isEqualTo("{\"type\":\"number\",\"value\":Infinity}");
        assertThat(escaped.generate(infinite, OutputFormat.JSON, null)).isEqualTo("{\"type\":\"number\",\"value\":null}");
    }

    @Test
    @Tag("unit")
    void testNumberText() {
        assertThat(NumberText.format(3.0)).isEqualTo("3");
        assertThat(NumberText.format(-0.5)).isEqualTo("-0.5");
        assertThat(NumberText.format(0.1)).isEqualTo("0.1");
        assertThat(NumberText.format(1e20)).isEqualTo("100000000000000000000");
        assertThat(NumberText.format(Double.NaN)).isEqualTo("NaN");
    }

    /**
     * Verifies that only prompt definitions produce text while every statement keeps its separator.
     */
    @Test
    @Tag("unit")
    void testTextRendering() {
        // Act
        String text = generate(PROGRAM, OutputFormat.TEXT);

        // Assert
        assertThat(text).isEqualTo(
                "\n\n\n"
                + "Prompt: p\n$greeting, world @sign(\"me\"){{IF $formal}}Sir{{ELSE}}pal{{END}}\n");
    }

    /**
     * Verifies the text of the greeting example.
     */
    @Test
    @Tag("unit")
    void testTextRenderingOfGreeting() {
        // Act
        String text = generate("VAR greeting = \"Hi\"; PROMPT p { \"$greeting, world\" } OUTPUT p AS JSON;",
                OutputFormat.TEXT);

        // Assert
        assertThat(text).isEqualTo("\nPrompt: p\n$greeting, world\n");
    }

    /**
     * Verifies that Markdown uses sections and inline code but keeps literal text untouched.
     */
    @Test
    @Tag("unit")
    void testMarkdownRendering() {
        // Act
        String markdown = generate(PROGRAM, OutputFormat.MARKDOWN);

        // Assert
        assertThat(markdown).isEqualTo(
                "\n\n\n\n\n\n"
                + "## Prompt: p\n\n`$greeting`, world `@sign(\"me\")`{{IF $formal}}Sir{{ELSE}}pal{{END}}\n\n");
    }

    /**
     * Verifies that printed expressions keep their grouping and loops keep their markers.
     */
    @Test
    @Tag("unit")
    void testExpressionsAndLoopsInText() {
        // Act
        String text = generate(String.join("\n",
                "PROMPT p {",
                "  IF ($a + 1) * 2 - -3 > 0 { \"x\" }",
                "  IF NOT $a IN [1, \"b\"] AND upper($s) { \"y\" }",
                "  FOR i IN [1, 2] { $i } WHILE $go { \".\" }",
                "}"), OutputFormat.TEXT);

        // Assert
        assertThat(text).isEqualTo("Prompt: p\n"
                + "{{IF ((($a + 1) * 2) - -3) > 0}}x{{END}}"
                + "{{IF NOT ($a IN [1, \"b\"]) AND upper($s)}}y{{END}}"
                + "{{FOR i IN [1, 2]}}$i{{END}}{{WHILE $go}}.{{END}}\n");
    }

    /**
     * Verifies that a very long operator chain fails with a resource error in every format
     * instead of exhausting the call stack.
     */
    @Test
    @Tag("unit")
    void testLongExpressionChainHitsNestingLimit() {
        // Arrange
        ProgramNode program = parse("PROMPT p { IF $a { \"x\" } }");
        IfNode ifNode = (IfNode) ((PromptDefNode) program.statements().get(0)).body().get(0);
        AstNode chain = ifNode.condition();
        for (int i = 0; i < 100_000; i++) {
            chain = new BinaryExprNode(Operator.ADD, chain, new VariableRefNode("a", POS), POS);
        }
        ((PromptDefNode) program.statements().get(0)).body().set(0,
                new IfNode(chain, ifNode.thenBranch(), null, ifNode.position()));
        CodeGenerator generator = new CodeGenerator();

        // Act & Assert
        for (OutputFormat format : OutputFormat.values()) {
            assertThatThrownBy(() -> generator.generate(program, format, null))
                    .as("format %s", format)
                    .isInstanceOf(ResourceLimitException.class)
                    .hasMessageContaining("nesting depth exceeds limit of 256");
        }
    }

    @Test
    @Tag("unit")
    void testMissingEmitter() {
        assertThatThrownBy(() -> new CodeGenerator(new EmitterRegistry()).generate(new EmptyNode(POS), OutputFormat.TEXT, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No emitter registered for TEXT");
    }
}

package org.pcc.compiler.backend.emit;

/**
 * Renders the program as Markdown. Same structure as {@link TextEmitter}, with
 * prompts as level-two sections and references and calls as inline code.
 */
public class MarkdownEmitter extends TextEmitter {

    public MarkdownEmitter(int maxNestingDepth) {
        super(maxNestingDepth);
    }

    @Override
    protected String statementSeparator() {
        return "\n\n";
    }

    @Override
    protected String promptHeader(String name) {
        return "## Prompt: " + name + "\n\n";
    }

    @Override
    protected String code(String source) {
        return "`" + source + "`";
    }
}

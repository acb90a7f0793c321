package org.pcc.compiler.backend.emit;

import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes an AST into the requested {@link OutputFormat} by delegating to the
 * emitter registered for it. The symbol table is only read.
 */
public class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final EmitterRegistry registry;

    /**
     * Creates a generator with the options from {@code reference.conf}.
     */
    public CodeGenerator() {
        this(CompilerOptions.defaults());
    }

    public CodeGenerator(CompilerOptions options) {
        this(EmitterRegistry.initializeWithDefaults(options));
    }

    public CodeGenerator(EmitterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Generates the output text.
     * @param root The tree to render.
     * @param format The output format.
     * @param symbolTable The analyzed symbol table, may be null.
     * @return The rendered text.
     * @throws IllegalArgumentException if no emitter is registered for the format.
     * @throws org.pcc.compiler.util.ResourceLimitException if the tree nests too deeply.
     */
    public String generate(AstNode root, OutputFormat format, SymbolTable symbolTable) {
        IFormatEmitter emitter = registry.get(format)
                .orElseThrow(() -> new IllegalArgumentException("No emitter registered for " + format));
        String output = emitter.emit(root, symbolTable);
        LOG.debug("Generated {} characters of {}", output.length(), format);
        return output;
    }
}

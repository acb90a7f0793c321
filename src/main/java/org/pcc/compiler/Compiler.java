package org.pcc.compiler;

import org.pcc.compiler.api.CompilationException;
import org.pcc.compiler.api.CompilerErrorCode;
import org.pcc.compiler.api.ICompiler;
import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.backend.emit.CodeGenerator;
import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.diagnostics.DiagnosticsEngine;
import org.pcc.compiler.frontend.lexer.LexError;
import org.pcc.compiler.frontend.lexer.LexResult;
import org.pcc.compiler.frontend.lexer.Lexer;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ParseError;
import org.pcc.compiler.frontend.parser.ParseResult;
import org.pcc.compiler.frontend.parser.Parser;
import org.pcc.compiler.frontend.parser.ast.ProgramNode;
import org.pcc.compiler.frontend.semantics.AnalysisResult;
import org.pcc.compiler.frontend.semantics.SemanticAnalyzer;
import org.pcc.compiler.frontend.semantics.SemanticError;
import org.pcc.compiler.frontend.semantics.SymbolTable;
import org.pcc.compiler.optimizer.OptimizationPass;
import org.pcc.compiler.optimizer.OptimizationResult;
import org.pcc.compiler.optimizer.Optimizer;
import org.pcc.compiler.util.ResourceLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source
 * text to generated output. It holds no state between calls; every call creates fresh
 * stage instances.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;
    private final CodeGenerator codeGenerator;

    /**
     * Creates a compiler configured from system properties, application.conf and reference.conf.
     */
    public Compiler() {
        this(CompilerOptions.load());
    }

    public Compiler(CompilerOptions options) {
        this.options = options;
        this.codeGenerator = new CodeGenerator(options);
    }

    @Override
    public LexResult tokenize(String source, String fileName) {
        return new Lexer(source, fileName).scanTokens();
    }

    @Override
    public ParseResult parse(List<Token> tokens) {
        return new Parser(tokens, options.maxNestingDepth()).parse();
    }

    @Override
    public AnalysisResult analyze(ProgramNode program) {
        return new SemanticAnalyzer(options.maxNestingDepth()).analyze(program);
    }

    @Override
    public OptimizationResult optimize(ProgramNode program, Set<OptimizationPass> passes) {
        return new Optimizer(passes, options.descendIntoDefinitions(), options.maxNestingDepth()).optimize(program);
    }

    @Override
    public String generate(ProgramNode program, OutputFormat format, SymbolTable symbolTable) {
        return codeGenerator.generate(program, format, symbolTable);
    }

    @Override
    public String compile(String source, String fileName, OutputFormat format) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            // Phase 1: Lexical Analysis
            LexResult lexed = tokenize(source, fileName);
            if (lexed.error().isPresent()) {
                LexError error = lexed.error().get();
                diagnostics.report(error.toDiagnostic());
                throw new CompilationException(CompilerErrorCode.LEXICAL_ERROR,
                        "Lexical error in " + fileName + ": " + error.message(), diagnostics.getDiagnostics());
            }

            // Phase 2: Parsing (builds AST)
            ParseResult parsed = parse(lexed.tokens());
            if (!parsed.success()) {
                parsed.errors().stream().map(ParseError::toDiagnostic).forEach(diagnostics::report);
                throw new CompilationException(CompilerErrorCode.SYNTAX_ERROR,
                        parsed.errors().size() + " syntax error(s) in " + fileName + "\n" + diagnostics.summary(),
                        diagnostics.getDiagnostics());
            }

            // Phase 3: Semantic Analysis (symbol resolution, kind checking)
            AnalysisResult analyzed = analyze(parsed.program());
            diagnostics.addAll(analyzed.warnings());
            analyzed.errors().stream().map(SemanticError::toDiagnostic).forEach(diagnostics::report);
            if (diagnostics.hasErrors()) {
                throw new CompilationException(CompilerErrorCode.SEMANTIC_ERROR,
                        analyzed.errors().size() + " semantic error(s) in " + fileName + "\n" + diagnostics.summary(),
                        diagnostics.getDiagnostics());
            }
            if (!analyzed.warnings().isEmpty()) {
                LOG.warn("Compilation of {} produced warnings:\n{}", fileName, diagnostics.summary());
            }

            // Phase 4: Optimization (constant folding, dead-code elimination)
            OptimizationResult optimized = optimize(parsed.program(), options.optimizationPasses());

            // Phase 5: Code Generation
            String output = generate(optimized.program(), format, analyzed.symbolTable());
            LOG.debug("Compiled {} to {} ({} rewrites)", fileName, format, optimized.rewrites());
            return output;
        } catch (ResourceLimitException e) {
            diagnostics.reportError(e.getMessage(), e.getPosition());
            throw new CompilationException(CompilerErrorCode.RESOURCE_LIMIT, e.getMessage(), diagnostics.getDiagnostics());
        }
    }
}

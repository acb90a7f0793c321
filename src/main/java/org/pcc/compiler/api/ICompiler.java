package org.pcc.compiler.api;

import org.pcc.compiler.frontend.lexer.LexResult;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.parser.ParseResult;
import org.pcc.compiler.frontend.parser.ast.ProgramNode;
import org.pcc.compiler.frontend.semantics.AnalysisResult;
import org.pcc.compiler.frontend.semantics.SymbolTable;
import org.pcc.compiler.optimizer.OptimizationPass;
import org.pcc.compiler.optimizer.OptimizationResult;

import java.util.List;
import java.util.Set;

/**
 * Defines the public interface of the prompt compiler. Each stage can be run on its own
 * with the previous stage's output; {@link #compile} runs them all.
 */
public interface ICompiler {

    /**
     * Splits source text into tokens. Stops at the first lexical error.
     * @param source The source text.
     * @param fileName The logical file name used in positions.
     * @return The tokens and the error, if any.
     */
    LexResult tokenize(String source, String fileName);

    /**
     * Builds the AST from a token list ending in END_OF_FILE.
     * @param tokens The tokens.
     * @return The program and all syntax errors.
     */
    ParseResult parse(List<Token> tokens);

    /**
     * Builds the symbol table for a program and validates its references.
     * @param program The program.
     * @return The symbol table, errors and warnings.
     */
    AnalysisResult analyze(ProgramNode program);

    /**
     * Rewrites a program with the given passes.
     * @param program The program; updated in place.
     * @param passes The passes to apply.
     * @return The program and the number of rewrites.
     */
    OptimizationResult optimize(ProgramNode program, Set<OptimizationPass> passes);

    /**
     * Serializes a program.
     * @param program The program.
     * @param format The output format.
     * @param symbolTable The analyzed symbol table, may be null.
     * @return The generated text.
     */
    String generate(ProgramNode program, OutputFormat format, SymbolTable symbolTable);

    /**
     * Runs the whole pipeline with the configured optimization passes.
     *
     * @param source The source text.
     * @param fileName The logical file name used in diagnostics.
     * @param format The output format.
     * @return The generated text.
     * @throws CompilationException if any stage reports errors or the input nests too deeply.
     */
    String compile(String source, String fileName, OutputFormat format) throws CompilationException;
}

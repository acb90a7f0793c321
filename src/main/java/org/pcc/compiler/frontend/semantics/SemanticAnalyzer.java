package org.pcc.compiler.frontend.semantics;

import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.diagnostics.DiagnosticsEngine;
import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.CallNode;
import org.pcc.compiler.frontend.parser.ast.ForNode;
import org.pcc.compiler.frontend.parser.ast.IdentifierNode;
import org.pcc.compiler.frontend.parser.ast.ProgramNode;
import org.pcc.compiler.frontend.parser.ast.VariableRefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintDefNode;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintExprNode;
import org.pcc.compiler.frontend.parser.features.output.OutputSpecNode;
import org.pcc.compiler.frontend.parser.features.prompt.PromptDefNode;
import org.pcc.compiler.frontend.parser.features.template.TemplateDefNode;
import org.pcc.compiler.frontend.parser.features.var.VarDeclNode;
import org.pcc.compiler.frontend.semantics.analysis.*;
import org.pcc.compiler.util.DepthGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: builds the symbol table and checks that every
 * reference resolves to a symbol of the right kind.
 * It operates by traversing the AST and dispatching nodes to specific handlers.
 * <p>
 * Traversal is pre-order: a declaration is registered before its body is visited, so
 * a body sees its own name and everything declared before it. OUTPUT specifications are
 * visited after all statements and may name prompts declared anywhere in the file.
 */
public class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final int maxNestingDepth;

    /**
     * Constructs a new semantic analyzer with the default nesting limit.
     */
    public SemanticAnalyzer() {
        this(CompilerOptions.defaults().maxNestingDepth());
    }

    /**
     * Constructs a new semantic analyzer.
     * @param maxNestingDepth The deepest AST nesting accepted.
     */
    public SemanticAnalyzer(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        DeclarationAnalysisHandler declarations = new DeclarationAnalysisHandler();
        handlers.put(PromptDefNode.class, declarations);
        handlers.put(VarDeclNode.class, declarations);
        handlers.put(ConstraintDefNode.class, declarations);
        handlers.put(TemplateDefNode.class, new TemplateAnalysisHandler());
        handlers.put(ForNode.class, new ForAnalysisHandler());
        handlers.put(VariableRefNode.class, new VariableRefAnalysisHandler());
        handlers.put(CallNode.class, new CallAnalysisHandler());
        handlers.put(IdentifierNode.class, new IdentifierAnalysisHandler());
        handlers.put(ConstraintExprNode.class, new ConstraintExprAnalysisHandler());
        handlers.put(OutputSpecNode.class, new OutputAnalysisHandler());
    }

    /**
     * Analyzes a program with a fresh symbol table.
     * This is the main entry point for the semantic analysis phase.
     * @param program The program root.
     * @return The populated symbol table with all errors and warnings.
     * @throws org.pcc.compiler.util.ResourceLimitException if the tree nests too deeply.
     */
    public AnalysisResult analyze(ProgramNode program) {
        SymbolTable symbolTable = new SymbolTable();
        DepthGuard depthGuard = new DepthGuard("semantic analysis", maxNestingDepth);
        traverseAndAnalyze(program, symbolTable, depthGuard);

        DiagnosticsEngine warnings = new DiagnosticsEngine();
        for (Symbol symbol : symbolTable.unusedSymbols()) {
            if (symbol.kind() == SymbolKind.VARIABLE) {
                warnings.reportWarning(String.format("Variable '%s' is never used", symbol.name()), symbol.position());
            } else if (symbol.kind() == SymbolKind.PARAMETER) {
                warnings.reportWarning(String.format("Parameter '%s' is never used", symbol.name()), symbol.position());
            }
        }

        LOG.debug("Semantic analysis finished with {} errors, {} warnings and {} scopes",
                symbolTable.errors().size(), warnings.getDiagnostics().size(), symbolTable.allScopes().size());
        return new AnalysisResult(symbolTable, symbolTable.errors(), warnings.getDiagnostics());
    }

    private void traverseAndAnalyze(AstNode node, SymbolTable symbolTable, DepthGuard depthGuard) {
        depthGuard.enter(node.position());
        try {
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, symbolTable);
            }
            for (AstNode child : node.getChildren()) {
                traverseAndAnalyze(child, symbolTable, depthGuard);
            }
            if (handler != null) {
                handler.afterChildren(node, symbolTable);
            }
        } finally {
            depthGuard.exit();
        }
    }
}

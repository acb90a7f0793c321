package org.pcc.compiler.optimizer;

import org.pcc.compiler.frontend.parser.ast.AstNode;
import org.pcc.compiler.frontend.parser.ast.ProgramNode;

/**
 * The outcome of an {@link Optimizer} run.
 *
 * @param root The rewritten tree. For a program this is the same, updated root node.
 * @param rewrites The number of folds and branch eliminations applied.
 */
public record OptimizationResult(AstNode root, int rewrites) {

    /**
     * @return The root as a program.
     * @throws IllegalStateException if the optimized tree was not a program.
     */
    public ProgramNode program() {
        if (!(root instanceof ProgramNode)) {
            throw new IllegalStateException("Optimized root is a " + root.kind() + ", not a PROGRAM");
        }
        return (ProgramNode) root;
    }
}

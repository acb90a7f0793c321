package org.pcc.compiler.optimizer;

import java.util.EnumSet;
import java.util.Set;

/**
 * The rewrite passes the {@link Optimizer} can apply.
 */
public enum OptimizationPass {
    /** Evaluates arithmetic on number literals and negation of boolean literals. */
    CONSTANT_FOLDING,
    /** Replaces IF nodes whose condition is a boolean literal by the taken branch. */
    DEAD_CODE_ELIMINATION,
    /** Reserved. Accepted but not implemented. */
    UNUSED_REMOVAL,
    /** Reserved. Accepted but not implemented. */
    INLINE_TEMPLATES,
    /** Enables every implemented pass. */
    ALL;

    /**
     * Checks whether this pass is requested by the given set, either directly or through {@link #ALL}.
     * @param requested The requested passes.
     * @return {@code true} if the pass should run.
     */
    public boolean isEnabledIn(Set<OptimizationPass> requested) {
        return requested.contains(this) || requested.contains(ALL);
    }

    /**
     * @return A set containing only {@link #ALL}.
     */
    public static Set<OptimizationPass> all() {
        return EnumSet.of(ALL);
    }
}

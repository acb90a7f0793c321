package org.pcc.compiler.util;

import org.pcc.compiler.api.SourcePosition;

/**
 * Counts recursion depth for a single stage run and fails with a
 * {@link ResourceLimitException} before the host call stack does.
 * <p>
 * Usage: {@code guard.enter(pos); try { ... } finally { guard.exit(); }}
 */
public class DepthGuard {

    private final String stage;
    private final int maxDepth;
    private int depth;

    /**
     * @param stage    The stage name used in the error message.
     * @param maxDepth The highest allowed depth, at least 1.
     */
    public DepthGuard(String stage, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.stage = stage;
        this.maxDepth = maxDepth;
    }

    public void enter(SourcePosition position) {
        if (++depth > maxDepth) {
            depth--;
            throw new ResourceLimitException(
                    String.format("%s: nesting depth exceeds limit of %d", stage, maxDepth), position);
        }
    }

    public void exit() {
        if (depth > 0) {
            depth--;
        }
    }

    public int depth() {
        return depth;
    }
}

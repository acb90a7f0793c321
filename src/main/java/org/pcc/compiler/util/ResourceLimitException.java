package org.pcc.compiler.util;

import org.pcc.compiler.api.SourcePosition;

/**
 * Thrown when the input nests deeper than the configured limit. Unchecked so that
 * recursive stages do not have to declare it; the compiler facade converts it into
 * a {@link org.pcc.compiler.api.CompilationException}.
 */
public class ResourceLimitException extends RuntimeException {

    private final SourcePosition position;

    public ResourceLimitException(String message, SourcePosition position) {
        super(message);
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    /**
     * @return The position where the limit was hit, or {@link SourcePosition#UNKNOWN}.
     */
    public SourcePosition getPosition() {
        return position;
    }
}

package org.pcc.compiler.api;

/**
 * Identifies the compilation stage that made a {@link CompilationException} fail.
 * Tests assert on these codes rather than on message texts.
 */
public enum CompilerErrorCode {
    // region Frontend Errors
    /** The lexer stopped at an invalid character or an unterminated string. */
    LEXICAL_ERROR,
    /** The parser reported one or more syntax errors. */
    SYNTAX_ERROR,
    /** The semantic analyzer reported one or more errors. */
    SEMANTIC_ERROR,
    // endregion

    // region General Errors
    /** The input nests deeper than the configured limit. */
    RESOURCE_LIMIT
    // endregion
}

package org.pcc.compiler.backend.emit;

/**
 * How string payloads are embedded into JSON output.
 */
public enum JsonEscaping {
    /** Strings are written as-is. Output is not valid JSON when they contain quotes, backslashes or control characters. */
    RAW,
    /** Strings are escaped so that the output is always valid JSON. */
    ESCAPED
}

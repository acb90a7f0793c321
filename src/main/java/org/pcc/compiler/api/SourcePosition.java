package org.pcc.compiler.api;

/**
 * A position in the source code. Attached to every token, AST node and error.
 *
 * @param line     The 1-based line number.
 * @param column   The 1-based column number.
 * @param fileName The logical name of the source file.
 */
public record SourcePosition(int line, int column, String fileName) {

    /** Used for errors that are not tied to a place in the source. */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, "<unknown>");

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}

package org.pcc.compiler.api;

import java.util.Locale;
import java.util.Optional;

/**
 * The serialization formats the code generator can produce.
 */
public enum OutputFormat {
    JSON,
    TEXT,
    MARKDOWN;

    /**
     * Looks up a format by its name, ignoring case.
     * @param name The name as written in an OUTPUT statement, e.g. {@code JSON}.
     * @return The format, or empty if the name is unknown.
     */
    public static Optional<OutputFormat> fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.name().equals(name.toUpperCase(Locale.ROOT))) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}

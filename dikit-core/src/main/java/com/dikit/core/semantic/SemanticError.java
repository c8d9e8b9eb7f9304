package com.dikit.core.semantic;

import java.util.Objects;

/**
 * A semantic rule violation found in a parsed schema.
 *
 * @param message human-readable description
 * @param line 1-based line of the offending node
 * @param column 1-based column of the offending node
 */
public record SemanticError(
    String message,
    int line,
    int column
) {
    public SemanticError {
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return "Semantic Error at [" + line + ":" + column + "]: " + message;
    }
}

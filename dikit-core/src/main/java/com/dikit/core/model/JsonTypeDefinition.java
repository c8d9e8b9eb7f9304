package com.dikit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Shape declared for a {@code json} field.
 *
 * @param raw the captured block text, braces included
 * @param isArray whether the field was declared as {@code json[]}
 * @param fields parsed entries (empty when the block could not be parsed)
 * @param line 1-based line of the block
 * @param column 1-based column of the block
 */
public record JsonTypeDefinition(
    String raw,
    boolean isArray,
    List<JsonField> fields,
    int line,
    int column
) {
    public JsonTypeDefinition {
        Objects.requireNonNull(raw, "raw must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}

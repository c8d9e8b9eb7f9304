package com.dikit.core.parser;

import com.dikit.core.model.SchemaNode;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Parser#parse()}.
 *
 * <p>The schema always holds the models that parsed cleanly; a schema accompanied by
 * errors must not be handed to later stages.
 *
 * @param schema successfully parsed models
 * @param errors every syntax error found, in source order
 */
public record ParseResult(
    SchemaNode schema,
    List<SyntaxError> errors
) {
    public ParseResult {
        Objects.requireNonNull(schema, "schema must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.dikit.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Root of a schema AST.
 *
 * <p>Built fresh by the parser from source text or by the introspector from a database
 * catalog; both produce the same shape so they can be diffed against each other.
 *
 * @param models models in declaration (or catalog) order
 * @param line 1-based line of the schema start
 * @param column 1-based column of the schema start
 */
public record SchemaNode(
    List<ModelNode> models,
    int line,
    int column
) {
    public SchemaNode {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public static SchemaNode of(List<ModelNode> models) {
        return new SchemaNode(models, 1, 1);
    }

    public static SchemaNode empty() {
        return of(List.of());
    }

    public Optional<ModelNode> model(String name) {
        return models.stream()
            .filter(model -> model.name().equals(name))
            .findFirst();
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}

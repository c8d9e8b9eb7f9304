package com.dikit.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A model declaration (one table).
 *
 * @param name model name
 * @param fields fields in declaration order
 * @param combinedUniques multi-column unique constraints, each a list of field names
 * @param line 1-based line of the {@code model} keyword
 * @param column 1-based column of the {@code model} keyword
 */
public record ModelNode(
    String name,
    List<FieldNode> fields,
    List<List<String>> combinedUniques,
    int line,
    int column
) {
    public ModelNode {
        Objects.requireNonNull(name, "name must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
        combinedUniques = combinedUniques == null
            ? List.of()
            : combinedUniques.stream().map(List::copyOf).toList();
    }

    public Optional<FieldNode> field(String fieldName) {
        return fields.stream()
            .filter(field -> field.name().equals(fieldName))
            .findFirst();
    }

    /**
     * Returns the fields that map to physical columns.
     *
     * @return column fields in declaration order
     */
    public List<FieldNode> columns() {
        return fields.stream().filter(FieldNode::isColumn).toList();
    }

    public Optional<FieldNode> primaryKey() {
        return fields.stream().filter(FieldNode::isPrimaryKey).findFirst();
    }
}

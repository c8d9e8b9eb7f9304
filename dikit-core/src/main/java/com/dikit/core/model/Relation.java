package com.dikit.core.model;

import java.util.Objects;

/**
 * Relation metadata attached to a field.
 *
 * @param type relation kind
 * @param foreignKey foreign key column name, or join table name for many-to-many (may be null)
 */
public record Relation(
    RelationType type,
    String foreignKey
) {
    public Relation {
        Objects.requireNonNull(type, "type must not be null");
    }

    public boolean hasForeignKey() {
        return foreignKey != null && !foreignKey.isBlank();
    }
}

package com.dikit.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A field declaration inside a model: either a physical column or a relation placeholder.
 *
 * <p>Every fact a decorator conveys is a plain component here. Nodes are immutable;
 * use {@link #builder(String, String)} or {@link #toBuilder()} to derive variants.
 *
 * @param name field name
 * @param fieldType primitive keyword, relation target model name or custom type name
 * @param isArray whether the field was declared with {@code []}
 * @param isPrimaryKey {@code @primary_key}
 * @param isRequired {@code @required}
 * @param isUnique {@code @unique}
 * @param defaultValue {@code @default(...)} value (may be null)
 * @param relation relation decorator (may be null)
 * @param jsonTypeDefinition declared JSON shape for {@code json} fields (may be null)
 * @param line 1-based line of the field name
 * @param column 1-based column of the field name
 */
public record FieldNode(
    String name,
    String fieldType,
    boolean isArray,
    boolean isPrimaryKey,
    boolean isRequired,
    boolean isUnique,
    DefaultValue defaultValue,
    Relation relation,
    JsonTypeDefinition jsonTypeDefinition,
    int line,
    int column
) {
    public FieldNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fieldType, "fieldType must not be null");
    }

    /**
     * Returns the scalar type of this field, if its type is a primitive keyword.
     *
     * @return scalar type, or empty for relation and custom types
     */
    public Optional<ScalarType> scalarType() {
        return ScalarType.fromKeyword(fieldType);
    }

    /**
     * Returns whether this field maps to a physical column.
     *
     * @return true for primitive-typed fields
     */
    public boolean isColumn() {
        return scalarType().isPresent();
    }

    /**
     * Returns whether the column rejects nulls. Primary keys are implicitly NOT NULL.
     *
     * @return true if required or primary key
     */
    public boolean isNotNull() {
        return isRequired || isPrimaryKey;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasRelation() {
        return relation != null;
    }

    public boolean hasRelation(RelationType type) {
        return relation != null && relation.type() == type;
    }

    public static Builder builder(String name, String fieldType) {
        return new Builder(name, fieldType);
    }

    public Builder toBuilder() {
        return new Builder(name, fieldType)
            .array(isArray)
            .primaryKey(isPrimaryKey)
            .required(isRequired)
            .unique(isUnique)
            .defaultValue(defaultValue)
            .relation(relation)
            .jsonTypeDefinition(jsonTypeDefinition)
            .position(line, column);
    }

    /**
     * Mutable builder used by the parser and the introspector while a node is assembled.
     */
    public static final class Builder {
        private final String name;
        private String fieldType;
        private boolean isArray;
        private boolean isPrimaryKey;
        private boolean isRequired;
        private boolean isUnique;
        private DefaultValue defaultValue;
        private Relation relation;
        private JsonTypeDefinition jsonTypeDefinition;
        private int line;
        private int column;

        private Builder(String name, String fieldType) {
            this.name = name;
            this.fieldType = fieldType;
        }

        public String name() {
            return name;
        }

        public Builder fieldType(String fieldType) {
            this.fieldType = fieldType;
            return this;
        }

        public Builder array(boolean isArray) {
            this.isArray = isArray;
            return this;
        }

        public Builder primaryKey(boolean isPrimaryKey) {
            this.isPrimaryKey = isPrimaryKey;
            return this;
        }

        public Builder required(boolean isRequired) {
            this.isRequired = isRequired;
            return this;
        }

        public Builder unique(boolean isUnique) {
            this.isUnique = isUnique;
            return this;
        }

        public Builder defaultValue(DefaultValue defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder relation(Relation relation) {
            this.relation = relation;
            return this;
        }

        public Builder jsonTypeDefinition(JsonTypeDefinition jsonTypeDefinition) {
            this.jsonTypeDefinition = jsonTypeDefinition;
            return this;
        }

        public Builder position(int line, int column) {
            this.line = line;
            this.column = column;
            return this;
        }

        public FieldNode build() {
            return new FieldNode(name, fieldType, isArray, isPrimaryKey, isRequired, isUnique,
                defaultValue, relation, jsonTypeDefinition, line, column);
        }
    }
}

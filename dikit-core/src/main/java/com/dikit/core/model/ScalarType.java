package com.dikit.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Primitive column types of the schema language.
 *
 * <p>A field whose type is one of these keywords maps to a physical column. Any other
 * type name is a relation target or a custom type and produces no column.
 */
public enum ScalarType {
    INT("int"),
    STRING("string"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    JSON("json"),
    DATETIME("datetime"),
    DATE("date");

    private final String keyword;

    ScalarType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the keyword used for this type in schema source.
     *
     * @return source keyword, e.g. {@code "int"}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a scalar type by its source keyword.
     *
     * @param keyword type name as written in the schema
     * @return the scalar type, or empty if the name is not a primitive
     */
    public static Optional<ScalarType> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(type -> type.keyword.equals(keyword))
            .findFirst();
    }
}

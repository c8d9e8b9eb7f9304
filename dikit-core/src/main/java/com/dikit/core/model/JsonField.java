package com.dikit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One named entry of a JSON sub-type shape.
 *
 * @param name entry name
 * @param optional whether the entry was declared with {@code ?}
 * @param type type name as written, or {@code "object"} for a nested block
 * @param isArray whether the entry was declared with {@code []}
 * @param fields nested entries when {@code type} is {@code "object"}
 */
public record JsonField(
    String name,
    boolean optional,
    String type,
    boolean isArray,
    List<JsonField> fields
) {
    public static final String OBJECT = "object";

    public JsonField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public boolean isObject() {
        return OBJECT.equals(type);
    }
}

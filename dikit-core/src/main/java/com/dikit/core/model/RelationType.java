package com.dikit.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relation kinds a field decorator can declare.
 */
public enum RelationType {
    ONE_TO_MANY("one_to_many"),
    MANY_TO_ONE("many_to_one"),
    ONE_TO_ONE("one_to_one"),
    MANY_TO_MANY("many_to_many");

    private final String keyword;

    RelationType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<RelationType> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(type -> type.keyword.equals(keyword))
            .findFirst();
    }
}

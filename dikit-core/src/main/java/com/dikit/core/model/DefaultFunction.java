package com.dikit.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Zero-argument generator functions allowed in {@code @default(...)}.
 */
public enum DefaultFunction {
    AUTOINCREMENT("autoincrement"),
    UUID("uuid"),
    NOW("now");

    private final String functionName;

    DefaultFunction(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    public static Optional<DefaultFunction> fromName(String name) {
        return Arrays.stream(values())
            .filter(function -> function.functionName.equals(name))
            .findFirst();
    }
}

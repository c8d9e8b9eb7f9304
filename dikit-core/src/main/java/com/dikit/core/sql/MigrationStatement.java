package com.dikit.core.sql;

import java.util.Objects;

/**
 * One entry of a migration script: an executable SQL statement or a comment line.
 *
 * @param sql statement text including the trailing semicolon, or the full comment line
 * @param comment whether this entry is a {@code --} comment that must not be executed
 */
public record MigrationStatement(
    String sql,
    boolean comment
) {
    public MigrationStatement {
        Objects.requireNonNull(sql, "sql must not be null");
    }

    public static MigrationStatement of(String sql) {
        return new MigrationStatement(sql, false);
    }

    public static MigrationStatement warning(String message) {
        return new MigrationStatement("-- WARNING: " + message, true);
    }
}

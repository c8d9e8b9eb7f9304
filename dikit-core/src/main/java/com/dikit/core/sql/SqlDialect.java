package com.dikit.core.sql;

import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.ScalarType;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Target SQL engine families.
 *
 * <p>Each lookup is a switch over both the scalar kind and the dialect, so adding a
 * constant to either enum fails compilation until every entry is provided.
 */
public enum SqlDialect {
    POSTGRES("postgres"),
    MYSQL("mysql"),
    SQLITE("sqlite"),
    GENERIC("generic");

    private final String id;

    SqlDialect(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a dialect from its identifier. {@code postgresql} is accepted as an alias.
     *
     * @param id dialect identifier, case-insensitive
     * @return the dialect, or empty if unknown
     */
    public static Optional<SqlDialect> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if ("postgresql".equals(normalized)) {
            return Optional.of(POSTGRES);
        }
        return Arrays.stream(values())
            .filter(dialect -> dialect.id.equals(normalized))
            .findFirst();
    }

    /**
     * Returns the native column type for a scalar type.
     *
     * @param type scalar type
     * @return native type, e.g. {@code VARCHAR(255)}
     */
    public String columnType(ScalarType type) {
        return switch (type) {
            case INT -> pick("INTEGER", "INT", "INTEGER", "INTEGER");
            case STRING -> pick("VARCHAR(255)", "VARCHAR(255)", "TEXT", "VARCHAR(255)");
            case FLOAT -> pick("REAL", "FLOAT", "REAL", "FLOAT");
            case BOOLEAN -> pick("BOOLEAN", "TINYINT(1)", "BOOLEAN", "BOOLEAN");
            case JSON -> pick("JSONB", "JSON", "TEXT", "TEXT");
            case DATE -> pick("DATE", "DATE", "DATE", "DATE");
            case DATETIME -> pick("TIMESTAMP", "DATETIME", "DATETIME", "DATETIME");
        };
    }

    /**
     * Returns the native type for an array column of the given element type.
     *
     * <p>Only PostgreSQL has native arrays. Elsewhere arrays are stored as JSON documents.
     * JSON arrays are plain JSON values in every dialect.
     *
     * @param element element type
     * @return native array column type
     */
    public String arrayColumnType(ScalarType element) {
        if (element == ScalarType.JSON) {
            return columnType(ScalarType.JSON);
        }
        return switch (this) {
            case POSTGRES -> columnType(element) + "[]";
            case MYSQL, SQLITE, GENERIC -> columnType(ScalarType.JSON);
        };
    }

    /**
     * Returns the SQL expression for a function default, without the {@code DEFAULT} keyword.
     *
     * <p>{@code autoincrement()} has no expression form; it is rendered as identity syntax
     * on the primary key column instead.
     *
     * @param function default function
     * @return SQL expression, or empty if the dialect has no equivalent
     */
    public Optional<String> functionDefault(DefaultFunction function) {
        return switch (function) {
            case NOW -> Optional.of(pick("CURRENT_TIMESTAMP", "NOW()", "(DATETIME('now'))", "CURRENT_TIMESTAMP"));
            case UUID -> switch (this) {
                case POSTGRES -> Optional.of("gen_random_uuid()");
                case MYSQL -> Optional.of("(UUID())");
                case SQLITE -> Optional.of("(HEX(RANDOMBLOB(16)))");
                case GENERIC -> Optional.empty();
            };
            case AUTOINCREMENT -> Optional.empty();
        };
    }

    /**
     * Returns the self-contained identity type replacing the column type of an
     * auto-increment primary key, if the dialect uses one.
     *
     * @return {@code SERIAL} for PostgreSQL, empty elsewhere
     */
    public Optional<String> serialType() {
        return this == POSTGRES ? Optional.of("SERIAL") : Optional.empty();
    }

    /**
     * Returns the keyword appended after {@code PRIMARY KEY} for auto-increment keys.
     *
     * @return identity keyword, or empty if the dialect has none
     */
    public Optional<String> autoIncrementKeyword() {
        return switch (this) {
            case MYSQL -> Optional.of("AUTO_INCREMENT");
            case SQLITE -> Optional.of("AUTOINCREMENT");
            case POSTGRES, GENERIC -> Optional.empty();
        };
    }

    /**
     * Returns whether column type and nullability changes must restate the full column
     * ({@code MODIFY COLUMN}) instead of altering one property.
     *
     * @return true for MySQL
     */
    public boolean restatesModifiedColumns() {
        return this == MYSQL;
    }

    private String pick(String postgres, String mysql, String sqlite, String generic) {
        return switch (this) {
            case POSTGRES -> postgres;
            case MYSQL -> mysql;
            case SQLITE -> sqlite;
            case GENERIC -> generic;
        };
    }
}

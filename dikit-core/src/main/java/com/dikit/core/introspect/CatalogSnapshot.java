package com.dikit.core.introspect;

import com.dikit.core.sql.SqlDialect;

import java.util.List;
import java.util.Objects;

/**
 * Raw catalog rows read from a live database, before they are mapped to schema nodes.
 *
 * <p>Reading and reconstruction are separate steps so that reconstruction can run
 * against hand-built snapshots.
 *
 * @param dialect dialect the catalog belongs to
 * @param columns every column of every user table
 * @param constraints primary key, unique and foreign key constraint columns
 */
public record CatalogSnapshot(
    SqlDialect dialect,
    List<Column> columns,
    List<Constraint> constraints
) {
    public CatalogSnapshot {
        Objects.requireNonNull(dialect, "dialect must not be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * One column as described by {@code information_schema.columns}.
     *
     * @param table table name
     * @param name column name
     * @param dataType generic data type (e.g. {@code character varying}, {@code ARRAY}, {@code int})
     * @param nativeType dialect-specific type ({@code udt_name} in PostgreSQL, {@code COLUMN_TYPE} in MySQL)
     * @param nullable whether the column accepts nulls
     * @param defaultExpression default expression as reported by the catalog (may be null)
     * @param extra MySQL {@code EXTRA} flags such as {@code auto_increment} (may be null)
     * @param ordinalPosition 1-based physical column position
     */
    public record Column(
        String table,
        String name,
        String dataType,
        String nativeType,
        boolean nullable,
        String defaultExpression,
        String extra,
        int ordinalPosition
    ) {
        public Column {
            Objects.requireNonNull(table, "table must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(dataType, "dataType must not be null");
        }
    }

    /**
     * Constraint kinds that are mapped back into the schema.
     */
    public enum ConstraintType {
        PRIMARY_KEY,
        UNIQUE,
        FOREIGN_KEY
    }

    /**
     * A table constraint with its columns in key order.
     *
     * @param name constraint name
     * @param type constraint type
     * @param table owning table
     * @param columns constrained columns
     * @param referencedTable referenced table for foreign keys, null otherwise
     */
    public record Constraint(
        String name,
        ConstraintType type,
        String table,
        List<String> columns,
        String referencedTable
    ) {
        public Constraint {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(table, "table must not be null");
            columns = columns == null ? List.of() : List.copyOf(columns);
        }
    }
}

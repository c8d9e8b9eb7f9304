package com.dikit.core.introspect;

import com.dikit.core.sql.SqlDialect;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Reads a PostgreSQL schema (by default {@code public}) through {@code information_schema}.
 */
public class PostgresCatalogReader extends InformationSchemaReader {

    static final String COLUMNS = """
        SELECT c.table_name,
               c.column_name,
               c.data_type,
               c.udt_name AS native_type,
               c.is_nullable,
               c.column_default,
               NULL AS extra,
               c.ordinal_position
        FROM information_schema.columns c
        JOIN information_schema.tables t
          ON t.table_schema = c.table_schema
         AND t.table_name = c.table_name
        WHERE c.table_schema = ?
          AND t.table_type = 'BASE TABLE'
        ORDER BY c.table_name, c.ordinal_position
        """;

    static final String CONSTRAINTS = """
        SELECT tc.constraint_name,
               tc.constraint_type,
               tc.table_name,
               kcu.column_name,
               kcu.ordinal_position,
               ccu.table_name AS referenced_table
        FROM information_schema.table_constraints tc
        JOIN information_schema.key_column_usage kcu
          ON tc.constraint_name = kcu.constraint_name
         AND tc.table_schema = kcu.table_schema
         AND tc.table_name = kcu.table_name
        LEFT JOIN (SELECT DISTINCT constraint_schema, constraint_name, table_name
                   FROM information_schema.constraint_column_usage) ccu
          ON tc.constraint_type = 'FOREIGN KEY'
         AND ccu.constraint_schema = tc.table_schema
         AND ccu.constraint_name = tc.constraint_name
        WHERE tc.table_schema = ?
          AND tc.constraint_type IN ('PRIMARY KEY', 'UNIQUE', 'FOREIGN KEY')
        ORDER BY tc.table_name, tc.constraint_name, kcu.ordinal_position
        """;

    private final String schema;

    public PostgresCatalogReader() {
        this("public");
    }

    public PostgresCatalogReader(String schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.POSTGRES;
    }

    @Override
    protected String columnsQuery() {
        return COLUMNS;
    }

    @Override
    protected String constraintsQuery() {
        return CONSTRAINTS;
    }

    @Override
    protected void bind(PreparedStatement statement) throws SQLException {
        statement.setString(1, schema);
    }
}

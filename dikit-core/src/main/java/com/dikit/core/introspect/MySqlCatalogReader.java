package com.dikit.core.introspect;

import com.dikit.core.sql.SqlDialect;

/**
 * Reads the current MySQL database ({@code DATABASE()}) through {@code information_schema}.
 */
public class MySqlCatalogReader extends InformationSchemaReader {

    static final String COLUMNS = """
        SELECT c.TABLE_NAME AS table_name,
               c.COLUMN_NAME AS column_name,
               c.DATA_TYPE AS data_type,
               c.COLUMN_TYPE AS native_type,
               c.IS_NULLABLE AS is_nullable,
               c.COLUMN_DEFAULT AS column_default,
               c.EXTRA AS extra,
               c.ORDINAL_POSITION AS ordinal_position
        FROM information_schema.COLUMNS c
        JOIN information_schema.TABLES t
          ON t.TABLE_SCHEMA = c.TABLE_SCHEMA
         AND t.TABLE_NAME = c.TABLE_NAME
        WHERE c.TABLE_SCHEMA = DATABASE()
          AND t.TABLE_TYPE = 'BASE TABLE'
        ORDER BY c.TABLE_NAME, c.ORDINAL_POSITION
        """;

    static final String CONSTRAINTS = """
        SELECT tc.CONSTRAINT_NAME AS constraint_name,
               tc.CONSTRAINT_TYPE AS constraint_type,
               tc.TABLE_NAME AS table_name,
               kcu.COLUMN_NAME AS column_name,
               kcu.ORDINAL_POSITION AS ordinal_position,
               kcu.REFERENCED_TABLE_NAME AS referenced_table
        FROM information_schema.TABLE_CONSTRAINTS tc
        JOIN information_schema.KEY_COLUMN_USAGE kcu
          ON tc.CONSTRAINT_SCHEMA = kcu.CONSTRAINT_SCHEMA
         AND tc.TABLE_NAME = kcu.TABLE_NAME
         AND tc.CONSTRAINT_NAME = kcu.CONSTRAINT_NAME
        WHERE tc.TABLE_SCHEMA = DATABASE()
          AND tc.CONSTRAINT_TYPE IN ('PRIMARY KEY', 'UNIQUE', 'FOREIGN KEY')
        ORDER BY tc.TABLE_NAME, tc.CONSTRAINT_NAME, kcu.ORDINAL_POSITION
        """;

    @Override
    public SqlDialect dialect() {
        return SqlDialect.MYSQL;
    }

    @Override
    protected String columnsQuery() {
        return COLUMNS;
    }

    @Override
    protected String constraintsQuery() {
        return CONSTRAINTS;
    }
}

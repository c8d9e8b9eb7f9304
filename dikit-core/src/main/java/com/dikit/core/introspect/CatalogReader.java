package com.dikit.core.introspect;

import com.dikit.core.sql.SqlDialect;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Reads the catalog of a live database into a {@link CatalogSnapshot}.
 *
 * <p>Implementations issue their queries sequentially on the given connection and never
 * modify the database.
 */
public interface CatalogReader {

    /**
     * @return dialect of the databases this reader understands
     */
    SqlDialect dialect();

    /**
     * Reads columns and constraints of all user tables.
     *
     * @param connection open connection
     * @return catalog snapshot; empty for a database without tables
     * @throws SQLException if a catalog query fails
     */
    CatalogSnapshot read(Connection connection) throws SQLException;
}

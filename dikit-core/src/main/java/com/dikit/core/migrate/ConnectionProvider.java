package com.dikit.core.migrate;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens database connections for the migrator.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection open(ConnectionSettings settings) throws SQLException;

    /**
     * Returns a provider backed by {@link DriverManager}; drivers are found on the classpath.
     *
     * @return JDBC driver manager provider
     */
    static ConnectionProvider driverManager() {
        return settings -> settings.user() == null
            ? DriverManager.getConnection(settings.jdbcUrl())
            : DriverManager.getConnection(settings.jdbcUrl(), settings.user(), settings.password());
    }
}

package com.dikit.core.migrate;

import com.dikit.core.introspect.SchemaIntrospector;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.sql.MigrationException;
import com.dikit.core.sql.MigrationGenerator;
import com.dikit.core.sql.MigrationPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Brings a live database in line with a compiled schema.
 *
 * <p>One run uses one connection: the deployed schema is introspected, diffed against the
 * target schema, and the resulting statements are executed one by one inside a single
 * JDBC transaction. Any failure rolls the transaction back and surfaces the full script.
 * Engines that commit DDL implicitly (MySQL) cannot roll back statements that already ran.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ConnectionSettings settings = ConnectionSettings.fromEnvironment("DATABASE_URL");
 * MigrationOutcome outcome = new Migrator(settings).migrate(schema, false);
 * }</pre>
 */
public class Migrator {

    private static final Logger log = LoggerFactory.getLogger(Migrator.class);

    private final ConnectionSettings settings;
    private final ConnectionProvider connections;
    private final SchemaIntrospector introspector;
    private final MigrationGenerator generator;

    public Migrator(ConnectionSettings settings) {
        this(settings, ConnectionProvider.driverManager(), SchemaIntrospector.forDialect(settings.dialect()));
    }

    public Migrator(ConnectionSettings settings, ConnectionProvider connections, SchemaIntrospector introspector) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
        this.generator = new MigrationGenerator(settings.dialect());
    }

    public MigrationOutcome migrate(SchemaNode current) {
        return migrate(current, false);
    }

    /**
     * Runs a migration.
     *
     * @param current target schema
     * @param dryRun whether to stop after generating the plan
     * @return outcome with the generated plan
     * @throws MigrationException if connecting, introspecting, generating or applying fails
     */
    public MigrationOutcome migrate(SchemaNode current, boolean dryRun) {
        Objects.requireNonNull(current, "current must not be null");
        log.info("Connecting to {}", settings.jdbcUrl());

        try (Connection connection = connections.open(settings)) {
            SchemaNode deployed = introspect(connection);
            if (deployed.isEmpty()) {
                log.info("No tables found; treating database as fresh");
            }

            MigrationPlan plan = generator.generate(deployed.isEmpty() ? null : deployed, current);
            if (!plan.hasChanges()) {
                log.info("Database schema is up to date");
                return new MigrationOutcome(MigrationOutcome.Status.NO_CHANGES, plan, 0);
            }
            if (dryRun) {
                log.info("Dry run: {} statements not applied", plan.statements().size());
                return new MigrationOutcome(MigrationOutcome.Status.DRY_RUN, plan, 0);
            }

            int executed = apply(connection, plan);
            return new MigrationOutcome(MigrationOutcome.Status.APPLIED, plan, executed);
        } catch (SQLException e) {
            throw new MigrationException("Database error: " + e.getMessage(), null, e);
        }
    }

    private SchemaNode introspect(Connection connection) {
        try {
            return introspector.introspect(connection);
        } catch (SQLException e) {
            throw new MigrationException("Failed to introspect database schema: " + e.getMessage(), null, e);
        }
    }

    private int apply(Connection connection, MigrationPlan plan) throws SQLException {
        List<String> statements = plan.executableStatements();
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        int executed = 0;

        try {
            for (String sql : statements) {
                try (Statement statement = connection.createStatement()) {
                    log.debug("Executing: {}", sql);
                    statement.execute(sql);
                    executed++;
                }
            }
            connection.commit();
            log.info("Applied {} migration statements", executed);
            return executed;
        } catch (SQLException e) {
            rollback(connection, e);
            log.error("Migration failed after {} of {} statements: {}", executed, statements.size(), e.getMessage());
            throw new MigrationException("Migration failed: " + e.getMessage(), plan.script(), e);
        } finally {
            restoreAutoCommit(connection, autoCommit);
        }
    }

    private static void rollback(Connection connection, SQLException failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit: {}", e.getMessage());
        }
    }
}

package com.dikit.core.introspect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base class for readers backed by {@code information_schema} views.
 *
 * <p>Subclasses supply two queries with fixed result column labels:
 * <ul>
 *   <li>columns: {@code table_name, column_name, data_type, native_type, is_nullable,
 *       column_default, extra, ordinal_position}</li>
 *   <li>constraints: {@code constraint_name, constraint_type, table_name, column_name,
 *       referenced_table}, ordered by table, constraint and key position</li>
 * </ul>
 */
public abstract class InformationSchemaReader implements CatalogReader {

    private static final Logger log = LoggerFactory.getLogger(InformationSchemaReader.class);

    protected abstract String columnsQuery();

    protected abstract String constraintsQuery();

    /**
     * Binds query parameters. Both queries share the same parameters.
     *
     * @param statement prepared catalog query
     * @throws SQLException if binding fails
     */
    protected void bind(PreparedStatement statement) throws SQLException {
        // no parameters by default
    }

    @Override
    public CatalogSnapshot read(Connection connection) throws SQLException {
        List<CatalogSnapshot.Column> columns = readColumns(connection);
        List<CatalogSnapshot.Constraint> constraints = columns.isEmpty() ? List.of() : readConstraints(connection);
        log.debug("Read {} columns and {} constraints from {} catalog",
            columns.size(), constraints.size(), dialect().id());
        return new CatalogSnapshot(dialect(), columns, constraints);
    }

    private List<CatalogSnapshot.Column> readColumns(Connection connection) throws SQLException {
        List<CatalogSnapshot.Column> columns = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(columnsQuery())) {
            bind(statement);
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    columns.add(new CatalogSnapshot.Column(
                        rows.getString("table_name"),
                        rows.getString("column_name"),
                        rows.getString("data_type"),
                        rows.getString("native_type"),
                        "YES".equalsIgnoreCase(rows.getString("is_nullable")),
                        rows.getString("column_default"),
                        rows.getString("extra"),
                        rows.getInt("ordinal_position")
                    ));
                }
            }
        }
        return columns;
    }

    private List<CatalogSnapshot.Constraint> readConstraints(Connection connection) throws SQLException {
        Map<String, ConstraintRows> grouped = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(constraintsQuery())) {
            bind(statement);
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    CatalogSnapshot.ConstraintType type = constraintType(rows.getString("constraint_type"));
                    if (type == null) {
                        continue;
                    }
                    String table = rows.getString("table_name");
                    String name = rows.getString("constraint_name");
                    String referencedTable = rows.getString("referenced_table");
                    ConstraintRows constraint = grouped.computeIfAbsent(table + "." + name,
                        key -> new ConstraintRows(name, type, table, referencedTable));
                    constraint.columns.add(rows.getString("column_name"));
                }
            }
        }
        return grouped.values().stream().map(ConstraintRows::toConstraint).toList();
    }

    private static CatalogSnapshot.ConstraintType constraintType(String type) {
        if (type == null) {
            return null;
        }
        return switch (type.toUpperCase(Locale.ROOT)) {
            case "PRIMARY KEY" -> CatalogSnapshot.ConstraintType.PRIMARY_KEY;
            case "UNIQUE" -> CatalogSnapshot.ConstraintType.UNIQUE;
            case "FOREIGN KEY" -> CatalogSnapshot.ConstraintType.FOREIGN_KEY;
            default -> null;
        };
    }

    private static final class ConstraintRows {
        private final String name;
        private final CatalogSnapshot.ConstraintType type;
        private final String table;
        private final String referencedTable;
        private final List<String> columns = new ArrayList<>();

        private ConstraintRows(String name, CatalogSnapshot.ConstraintType type, String table,
                               String referencedTable) {
            this.name = name;
            this.type = type;
            this.table = table;
            this.referencedTable = referencedTable;
        }

        private CatalogSnapshot.Constraint toConstraint() {
            return new CatalogSnapshot.Constraint(name, type, table, columns,
                type == CatalogSnapshot.ConstraintType.FOREIGN_KEY ? referencedTable : null);
        }
    }
}

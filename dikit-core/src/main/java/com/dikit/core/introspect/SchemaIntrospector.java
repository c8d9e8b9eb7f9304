package com.dikit.core.introspect;

import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.Relation;
import com.dikit.core.model.RelationType;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds a {@link SchemaNode} from a live database so it can be diffed against a parsed one.
 *
 * <p>The reconstruction mirrors what the parser would produce for the same schema:
 * <ul>
 *   <li>tables become models in name order, columns become fields in physical order</li>
 *   <li>foreign key columns carry a many-to-one relation and gain a relation field named
 *       after the referenced table</li>
 *   <li>join tables (two foreign keys, no other data columns) collapse into a pair of
 *       many-to-many fields and disappear from the model list</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SchemaIntrospector introspector = SchemaIntrospector.forDialect(SqlDialect.POSTGRES);
 * try (Connection connection = DriverManager.getConnection(url, user, password)) {
 *     SchemaNode deployed = introspector.introspect(connection);
 * }
 * }</pre>
 */
public class SchemaIntrospector {

    private static final Logger log = LoggerFactory.getLogger(SchemaIntrospector.class);
    private static final Set<String> JOIN_TABLE_TIMESTAMPS = Set.of("created_at", "updated_at");

    private final CatalogReader reader;

    public SchemaIntrospector(CatalogReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Creates an introspector with the catalog reader for a dialect.
     *
     * @param dialect database dialect
     * @return introspector
     * @throws IllegalArgumentException if the dialect cannot be introspected
     */
    public static SchemaIntrospector forDialect(SqlDialect dialect) {
        return switch (dialect) {
            case POSTGRES -> new SchemaIntrospector(new PostgresCatalogReader());
            case MYSQL -> new SchemaIntrospector(new MySqlCatalogReader());
            case SQLITE, GENERIC -> throw new IllegalArgumentException(
                "Introspection is not supported for dialect " + dialect.id());
        };
    }

    /**
     * Reads the catalog and rebuilds the schema.
     *
     * @param connection open connection
     * @return deployed schema; empty for a database without tables
     * @throws SQLException if a catalog query fails
     */
    public SchemaNode introspect(Connection connection) throws SQLException {
        CatalogSnapshot snapshot = reader.read(connection);
        SchemaNode schema = toSchema(snapshot);
        log.info("Introspected {} models from {} database", schema.models().size(), snapshot.dialect().id());
        return schema;
    }

    /**
     * Rebuilds a schema from a catalog snapshot.
     *
     * @param snapshot catalog rows
     * @return schema with models sorted by name
     */
    public SchemaNode toSchema(CatalogSnapshot snapshot) {
        Map<String, TableBuilder> tables = new LinkedHashMap<>();

        snapshot.columns().stream()
            .sorted(Comparator.comparing(CatalogSnapshot.Column::table)
                .thenComparingInt(CatalogSnapshot.Column::ordinalPosition))
            .forEach(column -> tables.computeIfAbsent(column.table(), TableBuilder::new)
                .fields.add(toField(snapshot.dialect(), column)));

        for (CatalogSnapshot.Constraint constraint : snapshot.constraints()) {
            TableBuilder table = tables.get(constraint.table());
            if (table == null) {
                log.debug("Skipping constraint {} of unknown table {}", constraint.name(), constraint.table());
                continue;
            }
            applyConstraint(table, constraint);
        }

        collapseJoinTables(tables);

        List<ModelNode> models = tables.values().stream()
            .map(TableBuilder::build)
            .toList();
        return new SchemaNode(models, 0, 0);
    }

    private static FieldNode.Builder toField(SqlDialect dialect, CatalogSnapshot.Column column) {
        NativeTypes.Mapped mapped = NativeTypes.map(dialect, column);
        return FieldNode.builder(column.name(), mapped.type().keyword())
            .array(mapped.isArray())
            .required(!column.nullable())
            .defaultValue(NativeTypes.parseDefault(dialect, column, mapped.type()));
    }

    private static void applyConstraint(TableBuilder table, CatalogSnapshot.Constraint constraint) {
        switch (constraint.type()) {
            case PRIMARY_KEY -> constraint.columns().forEach(column ->
                table.field(column).ifPresent(field -> field.primaryKey(true)));
            case UNIQUE -> {
                if (constraint.columns().size() == 1) {
                    table.field(constraint.columns().get(0)).ifPresent(field -> field.unique(true));
                } else {
                    table.combinedUniques.add(constraint.columns());
                }
            }
            case FOREIGN_KEY -> {
                String referenced = constraint.referencedTable();
                if (referenced == null) {
                    log.warn("Foreign key {} on {} has no referenced table", constraint.name(), table.name);
                    return;
                }
                for (String column : constraint.columns()) {
                    table.field(column).ifPresent(field -> {
                        field.relation(new Relation(RelationType.MANY_TO_ONE, column));
                        table.foreignKeys.add(new ForeignKey(column, referenced));
                    });
                    if (table.field(referenced).isEmpty()) {
                        table.fields.add(FieldNode.builder(referenced, referenced)
                            .relation(new Relation(RelationType.MANY_TO_ONE, column)));
                    }
                }
            }
        }
    }

    private static void collapseJoinTables(Map<String, TableBuilder> tables) {
        List<String> joinTables = new ArrayList<>();

        for (TableBuilder table : tables.values()) {
            if (!isJoinTable(table)) {
                continue;
            }
            TableBuilder left = tables.get(table.foreignKeys.get(0).referencedTable());
            TableBuilder right = tables.get(table.foreignKeys.get(1).referencedTable());
            if (left == null || right == null || left == table || right == table) {
                continue;
            }
            left.addManyToMany(right.name, table.name);
            right.addManyToMany(left.name, table.name);
            joinTables.add(table.name);
            log.debug("Collapsed join table {} into {} <-> {}", table.name, left.name, right.name);
        }

        joinTables.forEach(tables::remove);
    }

    private static boolean isJoinTable(TableBuilder table) {
        if (table.foreignKeys.size() != 2) {
            return false;
        }
        Set<String> foreignKeyColumns = Set.of(table.foreignKeys.get(0).column(), table.foreignKeys.get(1).column());
        return table.fields.stream()
            .map(FieldNode.Builder::build)
            .filter(FieldNode::isColumn)
            .allMatch(field -> foreignKeyColumns.contains(field.name())
                || field.isPrimaryKey()
                || JOIN_TABLE_TIMESTAMPS.contains(field.name()));
    }

    static String pluralize(String word) {
        if (word.endsWith("y")) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("s")) {
            return word;
        }
        return word + "s";
    }

    private record ForeignKey(String column, String referencedTable) {
    }

    private static final class TableBuilder {
        private final String name;
        private final List<FieldNode.Builder> fields = new ArrayList<>();
        private final List<List<String>> combinedUniques = new ArrayList<>();
        private final List<ForeignKey> foreignKeys = new ArrayList<>();

        private TableBuilder(String name) {
            this.name = name;
        }

        private Optional<FieldNode.Builder> field(String fieldName) {
            return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
        }

        private void addManyToMany(String target, String joinTable) {
            String fieldName = pluralize(target);
            if (field(fieldName).isEmpty()) {
                fields.add(FieldNode.builder(fieldName, target)
                    .array(true)
                    .relation(new Relation(RelationType.MANY_TO_MANY, joinTable)));
            }
        }

        private ModelNode build() {
            return new ModelNode(name, fields.stream().map(FieldNode.Builder::build).toList(),
                combinedUniques, 0, 0);
        }
    }
}

package com.dikit.core.sql;

import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.DefaultValue;
import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.RelationType;
import com.dikit.core.model.ScalarType;
import com.dikit.core.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates the SQL needed to move a database from one schema to another.
 *
 * <p>Without a previous schema every model is created, referenced tables first, followed
 * by one join table per many-to-many pair. With a previous schema the two trees are
 * compared model by model and column by column. Relation fields never produce columns;
 * only primitive-typed fields do.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * MigrationGenerator generator = new MigrationGenerator(SqlDialect.POSTGRES);
 * String script = generator.generateScript(null, schema);
 * }</pre>
 *
 * @see SqlDialect
 * @see MigrationPlan
 */
public class MigrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationGenerator.class);

    private final SqlDialect dialect;

    public MigrationGenerator(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /**
     * Generates a migration plan.
     *
     * @param previous schema currently deployed, or null (or empty) for a fresh database
     * @param current target schema
     * @return ordered statements; empty when both schemas are equivalent
     * @throws MigrationException if a default does not fit its column or a many-to-many
     *         relation cannot be turned into a join table
     */
    public MigrationPlan generate(SchemaNode previous, SchemaNode current) {
        Objects.requireNonNull(current, "current must not be null");
        List<MigrationStatement> statements = new ArrayList<>();

        if (previous == null || previous.isEmpty()) {
            log.debug("Generating full schema for {} models ({})", current.models().size(), dialect.id());
            for (ModelNode model : DependencyOrder.sort(current.models())) {
                statements.add(MigrationStatement.of(createTable(model, current)));
            }
            for (JoinTable joinTable : joinTables(current)) {
                statements.add(MigrationStatement.of(createJoinTable(joinTable)));
            }
        } else {
            log.debug("Diffing {} previous models against {} current models ({})",
                previous.models().size(), current.models().size(), dialect.id());
            statements.addAll(diff(previous, current));
        }

        log.info("Generated {} migration statements", statements.size());
        return new MigrationPlan(dialect, statements);
    }

    /**
     * Generates a migration and renders it as a script.
     *
     * @param previous schema currently deployed, or null for a fresh database
     * @param current target schema
     * @return transactional script, or {@link MigrationPlan#NO_CHANGES}
     */
    public String generateScript(SchemaNode previous, SchemaNode current) {
        return generate(previous, current).script();
    }

    private List<MigrationStatement> diff(SchemaNode previous, SchemaNode current) {
        List<MigrationStatement> statements = new ArrayList<>();

        for (ModelNode model : DependencyOrder.sort(current.models())) {
            Optional<ModelNode> previousModel = previous.model(model.name());
            if (previousModel.isEmpty()) {
                statements.add(MigrationStatement.of(createTable(model, current)));
            } else {
                statements.addAll(alterTable(previousModel.get(), model));
            }
        }

        Set<String> currentNames = current.models().stream().map(ModelNode::name).collect(Collectors.toSet());
        List<ModelNode> removed = new ArrayList<>(DependencyOrder.sort(previous.models()).stream()
            .filter(model -> !currentNames.contains(model.name()))
            .toList());
        Collections.reverse(removed);
        for (ModelNode model : removed) {
            statements.add(MigrationStatement.of("DROP TABLE " + model.name() + ";"));
        }

        if (hasManyToMany(current) || hasManyToMany(previous)) {
            log.warn("Many-to-many join tables are not compared when diffing; create or drop them manually");
        }
        return statements;
    }

    private List<MigrationStatement> alterTable(ModelNode previous, ModelNode current) {
        List<MigrationStatement> statements = new ArrayList<>();
        String table = current.name();

        for (FieldNode field : current.columns()) {
            Optional<FieldNode> previousField = previous.field(field.name()).filter(FieldNode::isColumn);
            if (previousField.isEmpty()) {
                statements.add(MigrationStatement.of(
                    "ALTER TABLE " + table + " ADD COLUMN " + columnDefinition(current, field) + ";"));
            } else {
                statements.addAll(alterColumn(current, previousField.get(), field));
            }
        }

        for (FieldNode previousField : previous.columns()) {
            if (current.field(previousField.name()).filter(FieldNode::isColumn).isEmpty()) {
                statements.add(MigrationStatement.of(
                    "ALTER TABLE " + table + " DROP COLUMN " + previousField.name() + ";"));
            }
        }
        return statements;
    }

    private List<MigrationStatement> alterColumn(ModelNode model, FieldNode previous, FieldNode current) {
        List<MigrationStatement> statements = new ArrayList<>();
        String prefix = "ALTER TABLE " + model.name() + " ";
        String column = current.name();

        boolean typeChanged = !sqlType(previous).equals(sqlType(current));
        boolean nullabilityChanged = previous.isNotNull() != current.isNotNull();
        boolean weakensPrimaryKey = nullabilityChanged && !current.isNotNull() && previous.isPrimaryKey();

        if (weakensPrimaryKey) {
            statements.add(MigrationStatement.warning(
                "Attempt to DROP NOT NULL on primary key column " + column + " skipped."));
        }

        if (dialect.restatesModifiedColumns()) {
            if (typeChanged || (nullabilityChanged && !weakensPrimaryKey)) {
                statements.add(MigrationStatement.of(
                    prefix + "MODIFY COLUMN " + restatedColumn(model, current, weakensPrimaryKey) + ";"));
            }
        } else if (nullabilityChanged && !weakensPrimaryKey) {
            statements.add(MigrationStatement.of(prefix + "ALTER COLUMN " + column
                + (current.isNotNull() ? " SET NOT NULL;" : " DROP NOT NULL;")));
        }

        DefaultValue previousDefault = previous.defaultValue();
        DefaultValue currentDefault = current.defaultValue();

        // A type change runs before the new default is set; the old default is dropped first
        // so the column can be converted without casting it.
        boolean defaultDropped = false;
        if (typeChanged && !dialect.restatesModifiedColumns()) {
            if (previousDefault != null && !isAutoIncrement(previousDefault) && !isAutoIncrement(currentDefault)) {
                statements.add(MigrationStatement.of(prefix + "ALTER COLUMN " + column + " DROP DEFAULT;"));
                defaultDropped = true;
            }
            String type = sqlType(current);
            StringBuilder alter = new StringBuilder(prefix)
                .append("ALTER COLUMN ").append(column).append(" TYPE ").append(type);
            if (dialect == SqlDialect.POSTGRES && current.scalarType().orElseThrow() == ScalarType.JSON) {
                alter.append(" USING ").append(column).append("::").append(type);
            }
            statements.add(MigrationStatement.of(alter.append(';').toString()));
        }

        if (defaultDropped || !Objects.equals(previousDefault, currentDefault)) {
            if (isAutoIncrement(previousDefault) || isAutoIncrement(currentDefault)) {
                statements.add(MigrationStatement.warning(
                    "Changing autoincrement on column " + column + " is not automated. Adjust the identity manually."));
            } else if (currentDefault == null) {
                if (!defaultDropped) {
                    statements.add(MigrationStatement.of(prefix + "ALTER COLUMN " + column + " DROP DEFAULT;"));
                }
            } else {
                validateDefault(model, current);
                defaultExpression(model, current).ifPresent(expression -> statements.add(MigrationStatement.of(
                    prefix + "ALTER COLUMN " + column + " SET DEFAULT " + expression + ";")));
            }
        }

        if (previous.isUnique() != current.isUnique()) {
            if (current.isUnique()) {
                statements.add(MigrationStatement.of(prefix + "ADD UNIQUE (" + column + ");"));
            } else {
                statements.add(MigrationStatement.warning("UNIQUE constraint removal for " + column
                    + " not automated. Please drop constraint manually if needed."));
            }
        }
        return statements;
    }

    private String createTable(ModelNode model, SchemaNode schema) {
        List<String> definitions = new ArrayList<>();

        for (FieldNode field : model.columns()) {
            definitions.add(columnDefinition(model, field));
        }
        for (List<String> unique : model.combinedUniques()) {
            definitions.add("UNIQUE (" + String.join(", ", unique) + ")");
        }
        for (FieldNode field : model.fields()) {
            if (DependencyOrder.isForeignKeyField(model, field)) {
                definitions.add("FOREIGN KEY (" + field.relation().foreignKey() + ") REFERENCES "
                    + field.fieldType() + "(" + referencedColumn(schema, field.fieldType()) + ")");
            }
        }

        if (definitions.isEmpty()) {
            log.warn("Model '{}' has no columns", model.name());
            return "CREATE TABLE " + model.name() + " ();";
        }
        return "CREATE TABLE " + model.name() + " (\n  " + String.join(",\n  ", definitions) + "\n);";
    }

    private String columnDefinition(ModelNode model, FieldNode field) {
        validateDefault(model, field);
        boolean autoIncrement = isAutoIncrement(field.defaultValue());
        if (autoIncrement && !field.isPrimaryKey()) {
            log.warn("autoincrement() is only supported on primary keys; ignored on {}.{}",
                model.name(), field.name());
        }

        if (autoIncrement && field.isPrimaryKey() && dialect.serialType().isPresent()) {
            return field.name() + " " + dialect.serialType().get() + " PRIMARY KEY";
        }

        StringBuilder column = new StringBuilder(field.name()).append(' ').append(sqlType(field));
        if (field.isPrimaryKey()) {
            column.append(" PRIMARY KEY");
            if (autoIncrement) {
                dialect.autoIncrementKeyword().ifPresent(keyword -> column.append(' ').append(keyword));
            }
        }
        if (field.isUnique()) {
            column.append(" UNIQUE");
        }
        defaultExpression(model, field).ifPresent(expression -> column.append(" DEFAULT ").append(expression));
        if (field.isNotNull()) {
            column.append(" NOT NULL");
        }
        return column.toString();
    }

    private String restatedColumn(ModelNode model, FieldNode field, boolean keepNotNull) {
        StringBuilder column = new StringBuilder(field.name()).append(' ').append(sqlType(field));
        if (field.isPrimaryKey() && isAutoIncrement(field.defaultValue())) {
            dialect.autoIncrementKeyword().ifPresent(keyword -> column.append(' ').append(keyword));
        }
        defaultExpression(model, field).ifPresent(expression -> column.append(" DEFAULT ").append(expression));
        if (field.isNotNull() || keepNotNull) {
            column.append(" NOT NULL");
        }
        return column.toString();
    }

    private String sqlType(FieldNode field) {
        ScalarType type = field.scalarType()
            .orElseThrow(() -> new MigrationException("No SQL type for " + field.fieldType()));
        return field.isArray() ? dialect.arrayColumnType(type) : dialect.columnType(type);
    }

    private Optional<String> defaultExpression(ModelNode model, FieldNode field) {
        DefaultValue value = field.defaultValue();
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof DefaultValue.Literal literal) {
            return Optional.of(switch (literal.kind()) {
                case NUMBER, BOOLEAN, EXPRESSION -> literal.text();
                case STRING -> quote(literal.text());
            });
        }
        DefaultFunction function = ((DefaultValue.FunctionCall) value).function();
        Optional<String> expression = dialect.functionDefault(function);
        if (expression.isEmpty() && function != DefaultFunction.AUTOINCREMENT) {
            log.warn("{}() has no {} equivalent; default omitted for {}.{}",
                function.functionName(), dialect.id(), model.name(), field.name());
        }
        return expression;
    }

    private void validateDefault(ModelNode model, FieldNode field) {
        DefaultValue value = field.defaultValue();
        if (value == null) {
            return;
        }
        ScalarType type = field.scalarType().orElseThrow();
        boolean valid;
        String description;
        if (value instanceof DefaultValue.Literal literal) {
            description = literal.kind().name().toLowerCase(Locale.ROOT) + " literal";
            valid = switch (literal.kind()) {
                case NUMBER -> type == ScalarType.INT || type == ScalarType.FLOAT;
                case BOOLEAN -> type == ScalarType.BOOLEAN;
                case STRING -> type == ScalarType.STRING || type == ScalarType.DATE
                    || type == ScalarType.DATETIME || type == ScalarType.JSON;
                case EXPRESSION -> true;
            };
        } else {
            DefaultFunction function = ((DefaultValue.FunctionCall) value).function();
            description = function.functionName() + "()";
            valid = switch (function) {
                case AUTOINCREMENT -> type == ScalarType.INT;
                case UUID -> type == ScalarType.STRING;
                case NOW -> type == ScalarType.DATETIME || type == ScalarType.DATE;
            };
        }
        if (!valid) {
            throw new MigrationException("Unsupported default " + description + " for column "
                + model.name() + "." + field.name() + " of type " + type.keyword());
        }
    }

    private List<JoinTable> joinTables(SchemaNode schema) {
        Map<String, JoinTable> byPair = new LinkedHashMap<>();

        for (ModelNode model : schema.models()) {
            for (FieldNode field : model.fields()) {
                if (!field.hasRelation(RelationType.MANY_TO_MANY)) {
                    continue;
                }
                ModelNode target = schema.model(field.fieldType()).orElseThrow(() -> new MigrationException(
                    "Many-to-many field " + model.name() + "." + field.name()
                        + " targets unknown model '" + field.fieldType() + "'"));

                ModelNode first = model.name().compareTo(target.name()) <= 0 ? model : target;
                ModelNode second = first == model ? target : model;
                String pairKey = first.name() + ":" + second.name();
                boolean explicit = field.relation().hasForeignKey();

                JoinTable existing = byPair.get(pairKey);
                if (existing != null && (existing.explicitName() || !explicit)) {
                    continue;
                }
                String name = explicit
                    ? field.relation().foreignKey()
                    : "_" + first.name() + "_" + second.name();
                byPair.put(pairKey, new JoinTable(name, explicit, first, second));
            }
        }

        log.debug("Found {} many-to-many join tables", byPair.size());
        return List.copyOf(byPair.values());
    }

    private String createJoinTable(JoinTable joinTable) {
        FieldNode leftKey = joinKey(joinTable, joinTable.left());
        FieldNode rightKey = joinKey(joinTable, joinTable.right());
        String leftColumn = "A_" + leftKey.name();
        String rightColumn = "B_" + rightKey.name();

        List<String> definitions = List.of(
            leftColumn + " " + dialect.columnType(leftKey.scalarType().orElseThrow()) + " NOT NULL",
            rightColumn + " " + dialect.columnType(rightKey.scalarType().orElseThrow()) + " NOT NULL",
            "FOREIGN KEY (" + leftColumn + ") REFERENCES " + joinTable.left().name()
                + "(" + leftKey.name() + ") ON DELETE CASCADE",
            "FOREIGN KEY (" + rightColumn + ") REFERENCES " + joinTable.right().name()
                + "(" + rightKey.name() + ") ON DELETE CASCADE",
            "UNIQUE (" + leftColumn + ", " + rightColumn + ")"
        );
        return "CREATE TABLE " + joinTable.name() + " (\n  " + String.join(",\n  ", definitions) + "\n);";
    }

    private static FieldNode joinKey(JoinTable joinTable, ModelNode model) {
        return model.primaryKey()
            .filter(FieldNode::isColumn)
            .orElseThrow(() -> new MigrationException("Model '" + model.name()
                + "' has no primary key; cannot build join table '" + joinTable.name() + "'"));
    }

    private static String referencedColumn(SchemaNode schema, String modelName) {
        return schema.model(modelName)
            .flatMap(ModelNode::primaryKey)
            .map(FieldNode::name)
            .orElse("id");
    }

    private static boolean hasManyToMany(SchemaNode schema) {
        return schema.models().stream()
            .flatMap(model -> model.fields().stream())
            .anyMatch(field -> field.hasRelation(RelationType.MANY_TO_MANY));
    }

    private static boolean isAutoIncrement(DefaultValue value) {
        return value != null && value.isCall(DefaultFunction.AUTOINCREMENT);
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private record JoinTable(String name, boolean explicitName, ModelNode left, ModelNode right) {
    }
}

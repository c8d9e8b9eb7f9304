package com.dikit.core.sql;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered statements produced for one migration run.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * MigrationPlan plan = new MigrationGenerator(SqlDialect.POSTGRES).generate(previous, current);
 * if (plan.hasChanges()) {
 *     System.out.println(plan.script());
 * }
 * }</pre>
 *
 * @param dialect dialect the statements were rendered for
 * @param statements statements and warning comments in execution order
 */
public record MigrationPlan(
    SqlDialect dialect,
    List<MigrationStatement> statements
) {
    /** Script returned when there is nothing to apply. */
    public static final String NO_CHANGES = "-- No changes detected.";

    public MigrationPlan {
        Objects.requireNonNull(dialect, "dialect must not be null");
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public boolean hasChanges() {
        return !statements.isEmpty();
    }

    /**
     * Returns the statements that are sent to the database, skipping comments.
     *
     * @return executable SQL statements
     */
    public List<String> executableStatements() {
        return statements.stream()
            .filter(statement -> !statement.comment())
            .map(MigrationStatement::sql)
            .toList();
    }

    /**
     * Renders the plan as one transactional script.
     *
     * @return {@code BEGIN; ... COMMIT;} block, or {@link #NO_CHANGES}
     */
    public String script() {
        if (statements.isEmpty()) {
            return NO_CHANGES;
        }
        return statements.stream()
            .map(MigrationStatement::sql)
            .collect(Collectors.joining("\n", "BEGIN;\n", "\nCOMMIT;"));
    }
}

package com.dikit.core.migrate;

import com.dikit.core.sql.MigrationPlan;

import java.util.Objects;

/**
 * Result of a migration run.
 *
 * @param status what happened
 * @param plan generated plan
 * @param executedStatements number of statements sent to the database
 */
public record MigrationOutcome(
    Status status,
    MigrationPlan plan,
    int executedStatements
) {
    public MigrationOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
    }

    /**
     * Migration run status.
     */
    public enum Status {
        /** Database already matches the schema. */
        NO_CHANGES,
        /** Script generated but not executed. */
        DRY_RUN,
        /** Script executed and committed. */
        APPLIED
    }
}

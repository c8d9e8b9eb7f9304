package com.dikit.core.sql;

/**
 * Raised when a migration cannot be generated or applied.
 *
 * <p>When thrown while applying, {@link #getScript()} holds the full script that was
 * attempted so operators can inspect it.
 */
public class MigrationException extends RuntimeException {

    private final String script;

    public MigrationException(String message) {
        super(message);
        this.script = null;
    }

    public MigrationException(String message, String script, Throwable cause) {
        super(message, cause);
        this.script = script;
    }

    /**
     * @return attempted script, or null for generation errors
     */
    public String getScript() {
        return script;
    }
}

package com.dikit.core.config;

import com.dikit.core.migrate.ConnectionSettings;
import com.dikit.core.sql.SqlDialect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for dikit projects.
 *
 * <p>Loaded from {@code dikit.yaml} in the project root. Missing sections fall back to
 * their defaults, so a file may configure only what it needs.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * schema: "schema.dikit"
 * dialect: postgres
 *
 * types:
 *   directory: "./generated"
 *   packageName: "com.example.schema"
 *   className: "SchemaTypes"
 *
 * diagrams:
 *   directory: "./docs/schema"
 *
 * database:
 *   urlVariable: "DATABASE_URL"
 * }</pre>
 *
 * @param schema schema source path
 * @param dialect default dialect for offline SQL generation
 * @param types type declaration output settings
 * @param diagrams diagram output settings
 * @param database database settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("schema") String schema,
    @JsonProperty("dialect") String dialect,
    @JsonProperty("types") TypesConfig types,
    @JsonProperty("diagrams") DiagramsConfig diagrams,
    @JsonProperty("database") DatabaseConfig database
) {
    public static final String DEFAULT_SCHEMA = "schema.dikit";

    public ProjectConfig {
        if (schema == null || schema.isBlank()) {
            schema = DEFAULT_SCHEMA;
        }
        if (dialect == null || dialect.isBlank()) {
            dialect = SqlDialect.POSTGRES.id();
        }
        types = types == null ? TypesConfig.defaults() : types;
        diagrams = diagrams == null ? DiagramsConfig.defaults() : diagrams;
        database = database == null ? DatabaseConfig.defaults() : database;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Resolves the configured dialect.
     *
     * @return dialect
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public SqlDialect sqlDialect() {
        return SqlDialect.fromId(dialect)
            .orElseThrow(() -> new IllegalArgumentException("Unknown dialect: " + dialect));
    }

    /**
     * Type declaration output.
     *
     * @param directory output directory
     * @param packageName Java package of the generated file
     * @param className name of the generated top-level class
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypesConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("packageName") String packageName,
        @JsonProperty("className") String className
    ) {
        public TypesConfig {
            directory = directory == null || directory.isBlank() ? "./generated" : directory;
            packageName = packageName == null ? "com.example.schema" : packageName;
            className = className == null || className.isBlank() ? "SchemaTypes" : className;
        }

        public static TypesConfig defaults() {
            return new TypesConfig(null, null, null);
        }
    }

    /**
     * Diagram output.
     *
     * @param directory output directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramsConfig(
        @JsonProperty("directory") String directory
    ) {
        public DiagramsConfig {
            directory = directory == null || directory.isBlank() ? "./docs/schema" : directory;
        }

        public static DiagramsConfig defaults() {
            return new DiagramsConfig(null);
        }
    }

    /**
     * Database settings. The connection string itself is only read from the environment.
     *
     * @param urlVariable environment variable holding the connection string
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatabaseConfig(
        @JsonProperty("urlVariable") String urlVariable
    ) {
        public DatabaseConfig {
            urlVariable = urlVariable == null || urlVariable.isBlank()
                ? ConnectionSettings.DEFAULT_VARIABLE
                : urlVariable;
        }

        public static DatabaseConfig defaults() {
            return new DatabaseConfig(null);
        }
    }
}

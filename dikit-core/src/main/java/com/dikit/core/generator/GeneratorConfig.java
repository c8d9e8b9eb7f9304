package com.dikit.core.generator;

import com.dikit.core.config.ProjectConfig;

import java.util.Objects;

/**
 * Settings passed to artifact generators.
 *
 * @param packageName Java package for type declarations (empty for the default package)
 * @param className top-level class name for type declarations
 * @param title diagram title
 */
public record GeneratorConfig(
    String packageName,
    String className,
    String title
) {
    public GeneratorConfig {
        packageName = packageName == null ? "" : packageName;
        Objects.requireNonNull(className, "className must not be null");
        title = title == null ? "Schema" : title;
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return from(ProjectConfig.defaults());
    }

    /**
     * Derives generator settings from project configuration.
     *
     * @param config project configuration
     * @return generator config
     */
    public static GeneratorConfig from(ProjectConfig config) {
        return new GeneratorConfig(config.types().packageName(), config.types().className(), "Schema");
    }
}

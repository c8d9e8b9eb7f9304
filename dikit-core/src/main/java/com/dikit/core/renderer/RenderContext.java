package com.dikit.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Destination and options for a render pass.
 *
 * @param outputDirectory directory artifact paths are resolved against
 * @param settings renderer-specific settings (e.g. {@code console.colors})
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue value returned when the key is absent
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public boolean getBooleanSetting(String key, boolean defaultValue) {
        return Boolean.parseBoolean(settings.getOrDefault(key, String.valueOf(defaultValue)));
    }
}

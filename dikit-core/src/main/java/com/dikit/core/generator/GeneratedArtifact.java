package com.dikit.core.generator;

import java.util.Objects;

/**
 * A generated artifact ready to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g. "com/example/SchemaTypes.java")
 * @param content file content
 * @param type artifact type
 */
public record GeneratedArtifact(
    String relativePath,
    String content,
    ArtifactType type
) {
    public GeneratedArtifact {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}

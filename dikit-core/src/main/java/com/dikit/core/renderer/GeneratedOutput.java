package com.dikit.core.renderer;

import com.dikit.core.generator.GeneratedArtifact;

import java.util.List;
import java.util.Objects;

/**
 * Artifacts produced by one compile run, handed to renderers as a unit.
 *
 * @param artifacts generated artifacts in generator order
 */
public record GeneratedOutput(
    List<GeneratedArtifact> artifacts
) {
    public GeneratedOutput {
        Objects.requireNonNull(artifacts, "artifacts must not be null");
        artifacts = List.copyOf(artifacts);
    }

    public static GeneratedOutput of(GeneratedArtifact... artifacts) {
        return new GeneratedOutput(List.of(artifacts));
    }

    public boolean isEmpty() {
        return artifacts.isEmpty();
    }
}

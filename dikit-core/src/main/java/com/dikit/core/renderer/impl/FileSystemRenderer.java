package com.dikit.core.renderer.impl;

import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.renderer.GeneratedOutput;
import com.dikit.core.renderer.OutputRenderer;
import com.dikit.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes artifacts below the context's output directory.
 *
 * <p>Directories are created as needed and existing files are overwritten. Content is
 * written as UTF-8. An artifact whose relative path resolves outside the output directory
 * is rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     GeneratedOutput.of(new GeneratedArtifact("com/example/SchemaTypes.java", source, ArtifactType.TYPE_DECLARATIONS)),
 *     RenderContext.of(Path.of("./generated")));
 * // Creates: ./generated/com/example/SchemaTypes.java
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.info("Writing {} artifacts to {}", output.artifacts().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedArtifact artifact : output.artifacts()) {
            write(outputDir, artifact);
        }
    }

    private void write(Path outputDir, GeneratedArtifact artifact) {
        Path target = outputDir.resolve(artifact.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException(
                "Artifact path escapes output directory: " + artifact.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, artifact.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", target, artifact.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + artifact.relativePath(), e);
        }
    }
}

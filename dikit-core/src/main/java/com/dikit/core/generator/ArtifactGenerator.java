package com.dikit.core.generator;

import com.dikit.core.model.SchemaNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Interface for generators that turn a validated schema into a file artifact.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Each produces
 * exactly one {@link ArtifactType}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidErGenerator implements ArtifactGenerator {
 *     @Override
 *     public String getId() {
 *         return "mermaid-er";
 *     }
 *
 *     @Override
 *     public GeneratedArtifact generate(SchemaNode schema, GeneratorConfig config) {
 *         return new GeneratedArtifact("schema-er.md", render(schema), ArtifactType.ER_DIAGRAM);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dikit.core.generator.ArtifactGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedArtifact
 */
public interface ArtifactGenerator {

    /**
     * Returns unique identifier for this generator (lowercase, e.g. "java-types").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    ArtifactType getArtifactType();

    /**
     * Generates the artifact. Input must be a schema that compiled without errors.
     *
     * <p>An empty schema still yields a valid artifact.
     *
     * @param schema validated schema
     * @param config generation settings
     * @return generated artifact
     */
    GeneratedArtifact generate(SchemaNode schema, GeneratorConfig config);

    /**
     * Loads all generators registered on the classpath.
     *
     * @return generators in registration order
     */
    static List<ArtifactGenerator> discover() {
        List<ArtifactGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ArtifactGenerator.class).forEach(generators::add);
        return generators;
    }

    static Optional<ArtifactGenerator> find(String id) {
        return discover().stream()
            .filter(generator -> generator.getId().equals(id))
            .findFirst();
    }
}

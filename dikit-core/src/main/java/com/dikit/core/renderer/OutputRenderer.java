package com.dikit.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Interface for renderers that deliver generated artifacts to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). The CLI writes
 * artifacts with the {@code filesystem} renderer and previews them with {@code console}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputRenderer renderer = OutputRenderer.find("filesystem").orElseThrow();
 * renderer.render(GeneratedOutput.of(artifact), RenderContext.of(Path.of("./generated")));
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dikit.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (lowercase, e.g. "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders every artifact of the output.
     *
     * @param output artifacts to render
     * @param context destination and settings
     * @throws IllegalStateException if an artifact cannot be delivered
     */
    void render(GeneratedOutput output, RenderContext context);

    static List<OutputRenderer> discover() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }

    static Optional<OutputRenderer> find(String id) {
        return discover().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst();
    }
}

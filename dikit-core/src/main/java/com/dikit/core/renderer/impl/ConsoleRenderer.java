package com.dikit.core.renderer.impl;

import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.renderer.GeneratedOutput;
import com.dikit.core.renderer.OutputRenderer;
import com.dikit.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints artifacts to a stream, with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors (default: "true")</li>
 *   <li>{@code console.showHeaders} - Print a header per artifact (default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    /**
     * Creates a renderer printing to {@link System#out}. Used by {@link java.util.ServiceLoader}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.getBooleanSetting("console.colors", true);
        boolean showHeaders = context.getBooleanSetting("console.showHeaders", true);
        log.debug("Printing {} artifacts (colors: {}, headers: {})",
            output.artifacts().size(), useColors, showHeaders);

        int total = output.artifacts().size();
        for (int i = 0; i < total; i++) {
            GeneratedArtifact artifact = output.artifacts().get(i);
            if (showHeaders) {
                printHeader(artifact, i + 1, total, useColors);
            }
            out.println(artifact.content());
            if (i < total - 1) {
                out.println(color(SEPARATOR, ANSI_YELLOW, useColors));
            }
        }
    }

    private void printHeader(GeneratedArtifact artifact, int index, int total, boolean useColors) {
        out.println(color("File " + index + "/" + total + ": " + artifact.relativePath(),
            ANSI_BOLD + ANSI_CYAN, useColors));
        out.println(color("Type: " + artifact.type().contentType(), ANSI_YELLOW, useColors));
        out.println();
    }

    private static String color(String text, String ansi, boolean useColors) {
        return useColors ? ansi + text + ANSI_RESET : text;
    }
}

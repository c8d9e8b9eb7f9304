package com.dikit.cli;

import com.dikit.core.generator.ArtifactGenerator;
import com.dikit.core.renderer.OutputRenderer;
import com.dikit.core.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available generators, renderers or dialects.
 *
 * <p>Generators and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dikit list generators
 * dikit list dialects
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators, renderers or dialects",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: generators, renderers or dialects")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            case "dialects", "dialect" -> listDialects();
            default -> {
                log.error("Unknown type: {}. Use: generators, renderers or dialects", type);
                System.err.println("✗ Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        List<ArtifactGenerator> generators = ArtifactGenerator.discover();
        for (ArtifactGenerator generator : generators) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    Output: %s (.%s)%n",
                generator.getArtifactType(), generator.getArtifactType().fileExtension());
            System.out.println();
        }

        if (generators.isEmpty()) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<OutputRenderer> renderers = OutputRenderer.discover();
        for (OutputRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listDialects() {
        System.out.println("Supported Dialects:");
        System.out.println();

        for (SqlDialect dialect : SqlDialect.values()) {
            boolean live = dialect == SqlDialect.POSTGRES || dialect == SqlDialect.MYSQL;
            System.out.printf("  • %s%s%n", dialect.id(), live ? " (generate, migrate)" : " (generate)");
        }
        return 0;
    }
}

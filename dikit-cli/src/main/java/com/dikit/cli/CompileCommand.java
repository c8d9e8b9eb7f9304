package com.dikit.cli;

import com.dikit.core.compiler.CompilationResult;
import com.dikit.core.config.ConfigLoader;
import com.dikit.core.config.ProjectConfig;
import com.dikit.core.generator.ArtifactGenerator;
import com.dikit.core.generator.ArtifactType;
import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.generator.GeneratorConfig;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.renderer.GeneratedOutput;
import com.dikit.core.renderer.OutputRenderer;
import com.dikit.core.renderer.RenderContext;
import com.dikit.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compile a schema and regenerate its artifacts.
 *
 * <p>Runs the full front end (lexer, parser, semantic analyzer). On success every
 * discovered artifact generator runs: type declarations are written below the types
 * directory and diagrams below the diagrams directory, overwriting earlier output.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Compile the schema named in dikit.yaml
 * dikit compile
 *
 * # Compile a specific file, failing on dangling relations
 * dikit compile models/shop.dikit --strict
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Validate a schema and write type declarations and diagrams",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "Schema file (default: from config)")
    private Path schemaPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: dikit.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE);

    @Option(names = {"--strict"}, description = "Require relation targets and foreign keys to exist")
    private boolean strict;

    @Option(names = {"--types-dir"}, description = "Type declaration output directory (overrides config)")
    private Path typesDir;

    @Option(names = {"--diagrams-dir"}, description = "Diagram output directory (overrides config)")
    private Path diagramsDir;

    @Option(names = {"--no-diagrams"}, description = "Skip diagram generation")
    private boolean skipDiagrams;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            Path source = schemaPath != null ? schemaPath : Paths.get(config.schema());

            CompilationResult result = SchemaSource.compile(source, strict);
            if (!result.isSuccessful()) {
                System.err.println("✗ Compilation failed: " + source);
                return 1;
            }
            SchemaNode schema = result.schema();
            System.out.println("✓ Compiled " + schema.models().size() + " models from " + source);

            GeneratorConfig generatorConfig = GeneratorConfig.from(config);
            OutputRenderer renderer = new FileSystemRenderer();

            for (ArtifactGenerator generator : ArtifactGenerator.discover()) {
                if (skipDiagrams && generator.getArtifactType() == ArtifactType.ER_DIAGRAM) {
                    log.debug("Skipping {}", generator.getId());
                    continue;
                }
                GeneratedArtifact artifact = generator.generate(schema, generatorConfig);
                Path outputDir = outputDirectory(generator.getArtifactType(), config);
                renderer.render(new GeneratedOutput(List.of(artifact)), RenderContext.of(outputDir));
                System.out.println("✓ " + generator.getDisplayName() + ": "
                    + outputDir.resolve(artifact.relativePath()));
            }

            return 0;
        } catch (Exception e) {
            log.error("Compile failed", e);
            System.err.println("✗ Compile failed: " + e.getMessage());
            return 1;
        }
    }

    private Path outputDirectory(ArtifactType type, ProjectConfig config) {
        return switch (type) {
            case TYPE_DECLARATIONS -> typesDir != null ? typesDir : Paths.get(config.types().directory());
            case ER_DIAGRAM -> diagramsDir != null ? diagramsDir : Paths.get(config.diagrams().directory());
        };
    }
}

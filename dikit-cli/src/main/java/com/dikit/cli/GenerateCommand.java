package com.dikit.cli;

import com.dikit.core.compiler.CompilationResult;
import com.dikit.core.config.ConfigLoader;
import com.dikit.core.config.ProjectConfig;
import com.dikit.core.generator.ArtifactGenerator;
import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.generator.GeneratorConfig;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.renderer.GeneratedOutput;
import com.dikit.core.renderer.RenderContext;
import com.dikit.core.renderer.impl.ConsoleRenderer;
import com.dikit.core.renderer.impl.FileSystemRenderer;
import com.dikit.core.sql.MigrationGenerator;
import com.dikit.core.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to generate a single artifact from a schema without touching a database.
 *
 * <p>{@code sql} emits a full creation script, or a diff script when {@code --previous}
 * names an older schema file. {@code types} and {@code er} run the matching artifact
 * generator. Output goes to stdout unless {@code -o} is given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Creation script for MySQL
 * dikit generate sql --dialect mysql
 *
 * # Diff between two schema revisions
 * dikit generate sql schema.dikit --previous schema.v1.dikit -o migration.sql
 *
 * # Mermaid ER diagram
 * dikit generate er -o docs
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate SQL, type declarations or an ER diagram from a schema",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final Map<String, String> GENERATOR_IDS = Map.of(
        "types", "java-types",
        "er", "mermaid-er");

    @Parameters(index = "0", description = "What to generate: sql, types or er")
    private String target;

    @Parameters(index = "1", arity = "0..1", description = "Schema file (default: from config)")
    private Path schemaPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: dikit.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE);

    @Option(names = {"-d", "--dialect"}, description = "SQL dialect: postgres, mysql, sqlite, generic (overrides config)")
    private String dialect;

    @Option(names = {"-p", "--previous"}, description = "Previous schema file to diff against")
    private Path previousPath;

    @Option(names = {"-o", "--output"},
        description = "Output file for sql, output directory for types and er (default: stdout)")
    private Path output;

    @Option(names = {"--strict"}, description = "Require relation targets and foreign keys to exist")
    private boolean strict;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            Path source = schemaPath != null ? schemaPath : Paths.get(config.schema());
            String kind = target.toLowerCase(Locale.ROOT);

            if (!"sql".equals(kind) && !GENERATOR_IDS.containsKey(kind)) {
                System.err.println("✗ Unknown target: " + target + ". Use: sql, types or er");
                return 1;
            }

            CompilationResult current = SchemaSource.compile(source, strict);
            if (!current.isSuccessful()) {
                System.err.println("✗ Compilation failed: " + source);
                return 1;
            }

            return "sql".equals(kind)
                ? generateSql(current.schema(), config)
                : generateArtifact(GENERATOR_IDS.get(kind), current.schema(), config);
        } catch (Exception e) {
            log.error("Generate failed", e);
            System.err.println("✗ Generate failed: " + e.getMessage());
            return 1;
        }
    }

    private int generateSql(SchemaNode schema, ProjectConfig config) throws Exception {
        SqlDialect sqlDialect = resolveDialect(config);

        SchemaNode previous = null;
        if (previousPath != null) {
            CompilationResult previousResult = SchemaSource.compile(previousPath, strict);
            if (!previousResult.isSuccessful()) {
                System.err.println("✗ Compilation failed: " + previousPath);
                return 1;
            }
            previous = previousResult.schema();
        }

        String script = new MigrationGenerator(sqlDialect).generateScript(previous, schema);
        if (output == null) {
            System.out.println(script);
        } else {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, script + "\n", StandardCharsets.UTF_8);
            System.out.println("✓ Wrote " + sqlDialect.id() + " script to " + output);
        }
        return 0;
    }

    private SqlDialect resolveDialect(ProjectConfig config) {
        if (dialect == null) {
            return config.sqlDialect();
        }
        return SqlDialect.fromId(dialect).orElseThrow(() -> new IllegalArgumentException(
            "Unknown dialect: " + dialect + ". Use: " + Arrays.stream(SqlDialect.values())
                .map(SqlDialect::id)
                .collect(Collectors.joining(", "))));
    }

    private int generateArtifact(String generatorId, SchemaNode schema, ProjectConfig config) {
        ArtifactGenerator generator = ArtifactGenerator.find(generatorId)
            .orElseThrow(() -> new IllegalStateException("Generator not registered: " + generatorId));
        GeneratedArtifact artifact = generator.generate(schema, GeneratorConfig.from(config));
        GeneratedOutput generated = GeneratedOutput.of(artifact);

        if (output == null) {
            new ConsoleRenderer().render(generated,
                new RenderContext(Paths.get("."), Map.of("console.colors", "false", "console.showHeaders", "false")));
        } else {
            new FileSystemRenderer().render(generated, RenderContext.of(output));
            System.out.println("✓ " + generator.getDisplayName() + ": " + output.resolve(artifact.relativePath()));
        }
        return 0;
    }
}

package com.dikit;

import ch.qos.logback.classic.Level;
import com.dikit.cli.CompileCommand;
import com.dikit.cli.GenerateCommand;
import com.dikit.cli.LintCommand;
import com.dikit.cli.ListCommand;
import com.dikit.cli.MigrateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for dikit.
 *
 * <p>dikit compiles a schema DSL into Java type declarations and SQL, and migrates a live
 * database to match it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Validate the schema and write type declarations and the ER diagram</li>
 *   <li>{@code lint} - Report every diagnostic in a schema file</li>
 *   <li>{@code generate} - Print SQL, type declarations or the ER diagram without a database</li>
 *   <li>{@code migrate} - Diff the schema against the database and apply the changes</li>
 *   <li>{@code list} - List available generators, renderers or dialects</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile schema.dikit using dikit.yaml
 * dikit compile
 *
 * # Preview the migration for the database in DATABASE_URL
 * dikit migrate --dry-run
 * }</pre>
 */
@Command(
    name = "dikit",
    mixinStandardHelpOptions = true,
    version = "dikit 1.0.0-SNAPSHOT",
    description = "Schema DSL compiler, SQL generator and database migrator",
    subcommands = {
        CompileCommand.class,
        LintCommand.class,
        GenerateCommand.class,
        MigrateCommand.class,
        ListCommand.class
    }
)
public class DikitCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("dikit - Schema DSL compiler and migrator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dikit --help' to see available commands");
        System.out.println("Use 'dikit <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DikitCLI cli = new DikitCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

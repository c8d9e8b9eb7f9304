package com.dikit.cli;

import com.dikit.core.compiler.CompilationResult;
import com.dikit.core.compiler.SchemaCompiler;
import com.dikit.core.lexer.LexError;
import com.dikit.core.parser.SyntaxError;
import com.dikit.core.semantic.SemanticAnalyzer;
import com.dikit.core.semantic.SemanticError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to report every diagnostic in a schema file, one per line.
 *
 * <p>Output lines have the form {@code path:line:column: message} so editors can jump to
 * them. Lexer warnings are reported but do not fail the run.
 */
@Command(
    name = "lint",
    description = "Report lexer warnings, syntax errors and semantic errors in a schema file",
    mixinStandardHelpOptions = true
)
public class LintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Parameters(index = "0", description = "Schema file to lint")
    private Path schemaPath;

    @Option(names = {"--strict"}, description = "Require relation targets and foreign keys to exist")
    private boolean strict;

    @Override
    public Integer call() {
        log.debug("Linting {} (strict: {})", schemaPath, strict);
        CompilationResult result = new SchemaCompiler(new SemanticAnalyzer(strict)).compileFile(schemaPath);

        for (LexError warning : result.warnings()) {
            report(warning.line(), warning.column(), "warning: " + warning.message());
        }
        if (result.failure() != null) {
            System.out.println(schemaPath + ": " + result.failure());
        }
        for (SyntaxError error : result.syntaxErrors()) {
            report(error.getLine(), error.getColumn(), error.getDetail());
        }
        for (SemanticError error : result.semanticErrors()) {
            report(error.line(), error.column(), error.message());
        }

        if (!result.isSuccessful()) {
            System.err.println("✗ Lint failed: " + result.errorMessages().size() + " error(s) in " + schemaPath);
            return 1;
        }
        System.out.println("✓ " + schemaPath + " is valid");
        return 0;
    }

    private void report(int line, int column, String message) {
        System.out.println(schemaPath + ":" + line + ":" + column + ": " + message);
    }
}

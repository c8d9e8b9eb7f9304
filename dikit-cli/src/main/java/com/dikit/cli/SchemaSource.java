package com.dikit.cli;

import com.dikit.core.compiler.CompilationResult;
import com.dikit.core.compiler.SchemaCompiler;
import com.dikit.core.lexer.LexError;
import com.dikit.core.semantic.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Compiles a schema file on behalf of a command and reports failures on stderr.
 */
final class SchemaSource {

    private static final Logger log = LoggerFactory.getLogger(SchemaSource.class);

    private SchemaSource() {
    }

    /**
     * Compiles the file, printing every error when compilation fails.
     *
     * @param path schema source file
     * @param strict whether relation targets and foreign keys must resolve
     * @return the compilation result
     */
    static CompilationResult compile(Path path, boolean strict) {
        log.info("Compiling schema: {}", path);
        CompilationResult result = new SchemaCompiler(new SemanticAnalyzer(strict)).compileFile(path);

        for (LexError warning : result.warnings()) {
            log.warn("{}: {}", path, warning);
        }
        if (!result.isSuccessful()) {
            result.errorMessages().forEach(message -> System.err.println(path + ": " + message));
            log.error("Compilation of {} failed with {} errors", path, result.errorMessages().size());
        }
        return result;
    }
}

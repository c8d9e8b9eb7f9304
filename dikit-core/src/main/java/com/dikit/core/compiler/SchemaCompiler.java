package com.dikit.core.compiler;

import com.dikit.core.lexer.LexError;
import com.dikit.core.lexer.Lexer;
import com.dikit.core.lexer.Token;
import com.dikit.core.lexer.TokenType;
import com.dikit.core.parser.ParseResult;
import com.dikit.core.parser.Parser;
import com.dikit.core.semantic.SemanticAnalyzer;
import com.dikit.core.semantic.SemanticError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs lexer, parser and semantic analyzer over one schema source.
 *
 * <p>Stops after the first stage that reports errors: semantic analysis is skipped when
 * parsing failed, since a partially recovered tree would produce misleading diagnostics.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CompilationResult result = new SchemaCompiler().compileFile(Path.of("schema.dikit"));
 * if (result.isSuccessful()) {
 *     SchemaNode schema = result.schema();
 * }
 * }</pre>
 */
public class SchemaCompiler {

    static final String NO_TOKENS = "No tokens generated";

    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final SemanticAnalyzer analyzer;

    public SchemaCompiler() {
        this(new SemanticAnalyzer());
    }

    public SchemaCompiler(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Compiles a schema file.
     *
     * @param path schema source file
     * @return compilation result; an unreadable file yields a failed result
     */
    public CompilationResult compileFile(Path path) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read schema file {}: {}", path, e.getMessage());
            return CompilationResult.failed(NO_TOKENS, List.of());
        }
        log.debug("Compiling schema file {}", path);
        return compile(source);
    }

    /**
     * Compiles schema source text.
     *
     * @param source schema source
     * @return compilation result
     */
    public CompilationResult compile(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        List<LexError> warnings = lexer.warnings();

        if (tokens.stream().allMatch(token -> token.is(TokenType.EOF))) {
            log.warn("Lexer produced no tokens");
            return CompilationResult.failed(NO_TOKENS, warnings);
        }

        ParseResult parsed = new Parser(tokens).parse();
        if (parsed.hasErrors()) {
            log.debug("Parsing failed with {} errors", parsed.errors().size());
            return new CompilationResult(parsed.schema(), warnings, parsed.errors(), List.of(), null);
        }

        List<SemanticError> semanticErrors = analyzer.analyze(parsed.schema());
        log.debug("Compiled {} models ({} semantic errors)",
            parsed.schema().models().size(), semanticErrors.size());
        return new CompilationResult(parsed.schema(), warnings, List.of(), semanticErrors, null);
    }
}

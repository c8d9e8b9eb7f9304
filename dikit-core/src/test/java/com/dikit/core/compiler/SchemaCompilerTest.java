package com.dikit.core.compiler;

import com.dikit.core.semantic.SemanticAnalyzer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SchemaCompiler}.
 */
class SchemaCompilerTest {

    @TempDir
    Path tempDir;

    private final SchemaCompiler compiler = new SchemaCompiler();

    @Test
    void compile_withValidSource_succeeds() {
        CompilationResult result = compiler.compile("model user { id int @primary_key }");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.schema().models()).hasSize(1);
        assertThat(result.errorMessages()).isEmpty();
    }

    @Test
    void compile_withOnlyComments_failsWithNoTokens() {
        CompilationResult result = compiler.compile("// nothing\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.failure()).isEqualTo(SchemaCompiler.NO_TOKENS);
        assertThat(result.errorMessages()).containsExactly("No tokens generated");
    }

    @Test
    void compile_withSyntaxError_skipsSemanticAnalysis() {
        // Given a source with both a syntax error and a naming violation
        String source = """
            model Bad {
              id int
            }
            model broken {
              x int @nope
            }
            """;

        // When
        CompilationResult result = compiler.compile(source);

        // Then
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.syntaxErrors()).hasSize(1);
        assertThat(result.semanticErrors()).isEmpty();
        assertThat(result.errorMessages()).containsExactly("Syntax Error at [5:10]: Unknown decorator '@nope'");
    }

    @Test
    void compile_withSemanticError_reportsIt() {
        CompilationResult result = compiler.compile("model Bad { id int }");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorMessages()).singleElement().asString().startsWith("Semantic Error at [1:1]:");
    }

    @Test
    void compile_keepsLexerWarningsOnSuccess() {
        CompilationResult result = compiler.compile("model user { id int # }");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void compile_withStrictAnalyzer_rejectsDanglingRelation() {
        SchemaCompiler strict = new SchemaCompiler(new SemanticAnalyzer(true));

        CompilationResult result = strict.compile("model post { author ghost @many_to_one }");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.semanticErrors()).hasSize(1);
    }

    @Test
    void compileFile_readsSourceFromDisk() throws IOException {
        Path file = tempDir.resolve("schema.dikit");
        Files.writeString(file, "model user { id int }");

        CompilationResult result = compiler.compileFile(file);

        assertThat(result.isSuccessful()).isTrue();
    }

    @Test
    void compileFile_withMissingFile_failsWithNoTokens() {
        CompilationResult result = compiler.compileFile(tempDir.resolve("missing.dikit"));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.failure()).isEqualTo(SchemaCompiler.NO_TOKENS);
    }
}

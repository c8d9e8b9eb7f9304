package com.dikit.core.compiler;

import com.dikit.core.lexer.LexError;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.parser.SyntaxError;
import com.dikit.core.semantic.SemanticError;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling one schema source.
 *
 * <p>{@code schema} is present whenever parsing ran, even if errors were found, so tooling
 * can still inspect the recovered models. Only a successful result may be used for
 * generation.
 *
 * @param schema parsed schema (empty when compilation stopped before parsing)
 * @param warnings lexer diagnostics
 * @param syntaxErrors parser errors
 * @param semanticErrors analyzer errors
 * @param failure stage-level failure message (e.g. "No tokens generated"), or null
 */
public record CompilationResult(
    SchemaNode schema,
    List<LexError> warnings,
    List<SyntaxError> syntaxErrors,
    List<SemanticError> semanticErrors,
    String failure
) {
    public CompilationResult {
        Objects.requireNonNull(schema, "schema must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        syntaxErrors = syntaxErrors == null ? List.of() : List.copyOf(syntaxErrors);
        semanticErrors = semanticErrors == null ? List.of() : List.copyOf(semanticErrors);
    }

    public static CompilationResult failed(String failure, List<LexError> warnings) {
        return new CompilationResult(SchemaNode.empty(), warnings, List.of(), List.of(), failure);
    }

    public boolean isSuccessful() {
        return failure == null && syntaxErrors.isEmpty() && semanticErrors.isEmpty();
    }

    /**
     * Returns every error message in stage order.
     *
     * @return formatted error messages, empty for a successful result
     */
    public List<String> errorMessages() {
        if (failure != null) {
            return List.of(failure);
        }
        if (!syntaxErrors.isEmpty()) {
            return syntaxErrors.stream().map(SyntaxError::getMessage).toList();
        }
        return semanticErrors.stream().map(SemanticError::toString).toList();
    }
}

package com.dikit.core.lexer;

/**
 * A lexer diagnostic. Lexer problems are warnings: the offending input is dropped from
 * the token stream and reported here.
 *
 * @param message description of the problem
 * @param line 1-based line
 * @param column 1-based column
 */
public record LexError(
    String message,
    int line,
    int column
) {
    @Override
    public String toString() {
        return "Lex Warning at [" + line + ":" + column + "]: " + message;
    }
}

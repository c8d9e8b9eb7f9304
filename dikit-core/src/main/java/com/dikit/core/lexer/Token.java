package com.dikit.core.lexer;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type token kind
 * @param value source text (string literals without quotes)
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(
    TokenType type,
    String value,
    int line,
    int column
) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null) {
            value = "";
        }
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}

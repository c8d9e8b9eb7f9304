package com.dikit.core.lexer;

/**
 * Token kinds produced by {@link Lexer}.
 */
public enum TokenType {
    MODEL_KEYWORD,

    INT_TYPE,
    STRING_TYPE,
    FLOAT_TYPE,
    BOOLEAN_TYPE,
    JSON_TYPE,
    DATETIME_TYPE,
    DATE_TYPE,

    COLON,
    LCURLY,
    RCURLY,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    AT,
    /** {@code @@unique}, {@code @@index} or {@code @@id}. */
    COMPOSITE_BLOCK,

    IDENTIFIER,
    STRING_LITERAL,
    NUMBER_LITERAL,
    /** Verbatim {@code { ... }} block captured after a {@code json} type keyword. */
    RAW_OBJECT,

    EOF,
    /** Unrecognized input; never handed to the parser. */
    UNKNOWN;

    /**
     * Returns whether this token is a primitive type keyword.
     *
     * @return true for {@code int}, {@code string}, {@code float}, {@code boolean},
     *         {@code json}, {@code datetime} and {@code date}
     */
    public boolean isTypeKeyword() {
        return switch (this) {
            case INT_TYPE, STRING_TYPE, FLOAT_TYPE, BOOLEAN_TYPE, JSON_TYPE, DATETIME_TYPE, DATE_TYPE -> true;
            default -> false;
        };
    }
}

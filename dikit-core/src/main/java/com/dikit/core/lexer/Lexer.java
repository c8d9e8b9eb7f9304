package com.dikit.core.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hand-written tokenizer for schema source.
 *
 * <p>Recognizes keywords, identifiers, punctuation, {@code @@} composite markers, string and
 * number literals, and skips {@code //} and {@code /* *}{@code /} comments. After a
 * {@code json} type keyword (and an optional {@code []}) the next {@code { ... }} block is
 * captured verbatim, nested braces included, as a single {@link TokenType#RAW_OBJECT}.
 *
 * <p>Problems never abort tokenizing. Each one is logged at WARN, recorded in
 * {@link #warnings()}, and the offending token is dropped from the returned stream.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Lexer lexer = new Lexer("model user { id int @primary_key }");
 * List<Token> tokens = lexer.tokenize();   // ends with EOF
 * List<LexError> warnings = lexer.warnings();
 * }</pre>
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private static final Set<String> COMPOSITE_BLOCKS = Set.of("unique", "index", "id");

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "model", TokenType.MODEL_KEYWORD,
        "int", TokenType.INT_TYPE,
        "string", TokenType.STRING_TYPE,
        "float", TokenType.FLOAT_TYPE,
        "boolean", TokenType.BOOLEAN_TYPE,
        "json", TokenType.JSON_TYPE,
        "datetime", TokenType.DATETIME_TYPE,
        "date", TokenType.DATE_TYPE
    );

    private final String input;
    private final List<LexError> warnings = new ArrayList<>();

    private int position;
    private int line = 1;
    private int column = 1;
    private boolean expectingRawObject;

    public Lexer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    /**
     * Tokenizes the whole input.
     *
     * @return tokens in source order, always terminated by {@link TokenType#EOF}
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            if (token.type() != TokenType.UNKNOWN) {
                tokens.add(token);
            }
        } while (token.type() != TokenType.EOF);

        log.debug("Tokenized {} characters into {} tokens ({} warnings)",
            input.length(), tokens.size(), warnings.size());
        return tokens;
    }

    /**
     * Returns the diagnostics recorded so far.
     *
     * @return lexer warnings in source order
     */
    public List<LexError> warnings() {
        return List.copyOf(warnings);
    }

    private Token nextToken() {
        skipWhitespaceAndComments();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        int startLine = line;
        int startColumn = column;
        char c = peek();

        if (expectingRawObject && c != '[' && c != ']') {
            expectingRawObject = false;
            if (c == '{') {
                return consumeRawObject(startLine, startColumn);
            }
        }

        switch (c) {
            case '{':
                advance();
                return new Token(TokenType.LCURLY, "{", startLine, startColumn);
            case '}':
                advance();
                return new Token(TokenType.RCURLY, "}", startLine, startColumn);
            case '(':
                advance();
                return new Token(TokenType.LPAREN, "(", startLine, startColumn);
            case ')':
                advance();
                return new Token(TokenType.RPAREN, ")", startLine, startColumn);
            case '[':
                advance();
                return new Token(TokenType.LBRACKET, "[", startLine, startColumn);
            case ']':
                advance();
                return new Token(TokenType.RBRACKET, "]", startLine, startColumn);
            case ',':
                advance();
                return new Token(TokenType.COMMA, ",", startLine, startColumn);
            case ':':
                advance();
                return new Token(TokenType.COLON, ":", startLine, startColumn);
            case '@':
                return consumeAt(startLine, startColumn);
            case '"':
            case '\'':
                return consumeStringLiteral(c, startLine, startColumn);
            default:
                break;
        }

        if (isIdentifierStart(c)) {
            String value = consumeIdentifier();
            TokenType type = KEYWORDS.getOrDefault(value, TokenType.IDENTIFIER);
            if (type == TokenType.JSON_TYPE) {
                expectingRawObject = true;
            }
            return new Token(type, value, startLine, startColumn);
        }

        if (isDigit(c) || (c == '-' && isDigit(peek(1)))) {
            return consumeNumberLiteral(startLine, startColumn);
        }

        advance();
        return unknown(String.valueOf(c), "Unexpected character '" + c + "'", startLine, startColumn);
    }

    private Token consumeAt(int startLine, int startColumn) {
        advance();
        if (peek() != '@') {
            return new Token(TokenType.AT, "@", startLine, startColumn);
        }
        advance();
        StringBuilder name = new StringBuilder();
        while (!isAtEnd() && (Character.isLetter(peek()) || peek() == '_')) {
            name.append(advance());
        }
        String value = "@@" + name;
        if (COMPOSITE_BLOCKS.contains(name.toString())) {
            return new Token(TokenType.COMPOSITE_BLOCK, value, startLine, startColumn);
        }
        return unknown(value, "Unknown composite block '" + value + "'", startLine, startColumn);
    }

    private Token consumeRawObject(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder();
        int depth = 0;
        while (!isAtEnd()) {
            char c = advance();
            value.append(c);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return new Token(TokenType.RAW_OBJECT, value.toString(), startLine, startColumn);
                }
            }
        }
        return unknown(value.toString(), "Unterminated json type block", startLine, startColumn);
    }

    private Token consumeStringLiteral(char quote, int startLine, int startColumn) {
        advance();
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            value.append(c);
            if (c == '\\' && !isAtEnd()) {
                value.append(advance());
            }
        }
        if (isAtEnd()) {
            return unknown(value.toString(), "Unterminated string literal", startLine, startColumn);
        }
        advance();
        return new Token(TokenType.STRING_LITERAL, value.toString(), startLine, startColumn);
    }

    private Token consumeNumberLiteral(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder();
        if (peek() == '-') {
            value.append(advance());
        }
        consumeDigits(value);
        if (peek() == '.') {
            value.append(advance());
            if (!isDigit(peek())) {
                return unknown(value.toString(), "Invalid number format '" + value + "'", startLine, startColumn);
            }
            consumeDigits(value);
        }
        return new Token(TokenType.NUMBER_LITERAL, value.toString(), startLine, startColumn);
    }

    private void consumeDigits(StringBuilder value) {
        while (!isAtEnd() && isDigit(peek())) {
            value.append(advance());
        }
    }

    private String consumeIdentifier() {
        StringBuilder value = new StringBuilder();
        // Hyphens are kept inside names so the naming rules can report them.
        while (!isAtEnd() && (isIdentifierStart(peek()) || isDigit(peek()) || peek() == '-')) {
            value.append(advance());
        }
        return value.toString();
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                boolean closed = false;
                while (!isAtEnd()) {
                    if (advance() == '*' && peek() == '/') {
                        advance();
                        closed = true;
                        break;
                    }
                }
                if (!closed) {
                    warn("Unterminated block comment", startLine, startColumn);
                }
            } else {
                break;
            }
        }
    }

    private Token unknown(String value, String message, int startLine, int startColumn) {
        warn(message, startLine, startColumn);
        return new Token(TokenType.UNKNOWN, value, startLine, startColumn);
    }

    private void warn(String message, int atLine, int atColumn) {
        LexError error = new LexError(message, atLine, atColumn);
        warnings.add(error);
        log.warn("{} at {}:{}", message, atLine, atColumn);
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return peek(0);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

package com.dikit.core.parser;

import com.dikit.core.lexer.Token;
import com.dikit.core.lexer.TokenType;
import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.DefaultValue;
import com.dikit.core.model.FieldNode;
import com.dikit.core.model.JsonTypeDefinition;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.Relation;
import com.dikit.core.model.RelationType;
import com.dikit.core.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser turning a token stream into a {@link SchemaNode}.
 *
 * <p>Works with one token of lookahead plus short offset peeks and never re-enters a rule.
 * A {@link SyntaxError} raised inside a model abandons that model only: the parser skips
 * to the next {@code model} keyword (or end of input) and carries on, so one pass reports
 * every independent error. If a recovery step fails to move the cursor, one token is
 * discarded and reported as unexpected, which guarantees termination.
 *
 * <p><b>Grammar:</b>
 * <pre>
 * schema           := model_def*
 * model_def        := "model" IDENT "{" (field_def | composite_unique)* "}"
 * composite_unique := "@@unique" "(" "[" IDENT ("," IDENT)* "]" ")"
 * field_def        := IDENT type ("[" "]")? decorator*
 * type             := primitive | "json" ("[" "]")? RAW_OBJECT | IDENT
 * decorator        := "@" ( relation_kind ("(" IDENT ")")?
 *                         | "primary_key" | "unique" | "required"
 *                         | "default" "(" default_value ")" )
 * default_value    := NUMBER | STRING | "true" | "false"
 *                   | ("autoincrement" | "uuid" | "now") "(" ")"
 * </pre>
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final List<SyntaxError> errors = new ArrayList<>();
    private int current;

    public Parser(List<Token> tokens) {
        List<Token> stream = new ArrayList<>(tokens);
        if (stream.isEmpty() || !stream.get(stream.size() - 1).is(TokenType.EOF)) {
            Token last = stream.isEmpty() ? null : stream.get(stream.size() - 1);
            stream.add(last == null
                ? new Token(TokenType.EOF, "", 1, 1)
                : new Token(TokenType.EOF, "", last.line(), last.column() + last.value().length()));
        }
        this.tokens = stream;
    }

    /**
     * Parses the whole token stream.
     *
     * @return parsed models together with every syntax error found
     */
    public ParseResult parse() {
        List<ModelNode> models = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            int startIndex = current;
            try {
                models.add(parseModelDefinition());
            } catch (SyntaxError e) {
                log.debug("Recovering from: {}", e.getMessage());
                errors.add(e);
                synchronize();
            }

            if (current == startIndex) {
                Token token = peek();
                errors.add(new SyntaxError("Unexpected token '" + token.value() + "'",
                    token.line(), token.column()));
                advance();
            }
        }

        log.debug("Parsed {} models with {} syntax errors", models.size(), errors.size());
        return new ParseResult(SchemaNode.of(models), errors);
    }

    private void synchronize() {
        while (!check(TokenType.MODEL_KEYWORD) && !check(TokenType.EOF)) {
            advance();
        }
    }

    private ModelNode parseModelDefinition() throws SyntaxError {
        Token modelToken = expect(TokenType.MODEL_KEYWORD, "Expected 'model' keyword");
        Token nameToken = expect(TokenType.IDENTIFIER, "Expected model name");
        expect(TokenType.LCURLY, "Expected '{' after model name");

        List<FieldNode> fields = new ArrayList<>();
        List<List<String>> combinedUniques = new ArrayList<>();

        while (!check(TokenType.RCURLY) && !check(TokenType.EOF)) {
            if (isFieldStart()) {
                fields.add(parseFieldDefinition());
            } else if (check(TokenType.COMPOSITE_BLOCK)) {
                Token block = advance();
                if ("@@unique".equals(block.value())) {
                    combinedUniques.add(parseCompositeUniqueFields());
                } else {
                    errors.add(new SyntaxError("Unsupported composite block '" + block.value() + "'",
                        block.line(), block.column()));
                    skipParenthesizedGroup();
                }
            } else {
                Token token = advance();
                errors.add(new SyntaxError("Unexpected token '" + token.value() + "' inside model",
                    token.line(), token.column()));
            }
        }

        expect(TokenType.RCURLY, "Expected '}' to close model '" + nameToken.value() + "'");

        return new ModelNode(nameToken.value(), fields, combinedUniques,
            modelToken.line(), modelToken.column());
    }

    /**
     * A field starts with an identifier, or with a type keyword used as a name
     * (e.g. {@code date date}) when another type token follows it.
     */
    private boolean isFieldStart() {
        if (check(TokenType.IDENTIFIER)) {
            return true;
        }
        return peek().type().isTypeKeyword() && isTypeStart(peek(1));
    }

    private static boolean isTypeStart(Token token) {
        return token.type().isTypeKeyword() || token.is(TokenType.IDENTIFIER);
    }

    private List<String> parseCompositeUniqueFields() throws SyntaxError {
        expect(TokenType.LPAREN, "Expected '(' after @@unique");
        expect(TokenType.LBRACKET, "Expected '[' after @@unique(");

        List<String> fields = new ArrayList<>();
        do {
            fields.add(expect(TokenType.IDENTIFIER, "Expected field name in @@unique").value());
        } while (match(TokenType.COMMA));

        expect(TokenType.RBRACKET, "Expected ',' or ']' in @@unique");
        expect(TokenType.RPAREN, "Expected ')' after @@unique");
        return fields;
    }

    private void skipParenthesizedGroup() {
        if (!check(TokenType.LPAREN)) {
            return;
        }
        int depth = 0;
        do {
            Token token = advance();
            if (token.is(TokenType.LPAREN)) {
                depth++;
            } else if (token.is(TokenType.RPAREN)) {
                depth--;
            }
        } while (depth > 0 && !check(TokenType.EOF));
    }

    private FieldNode parseFieldDefinition() throws SyntaxError {
        Token nameToken = advance();
        FieldNode.Builder field = FieldNode.builder(nameToken.value(), "")
            .position(nameToken.line(), nameToken.column());

        Token typeToken = peek();
        if (typeToken.is(TokenType.JSON_TYPE)) {
            advance();
            field.fieldType(typeToken.value());
            boolean jsonArray = false;
            if (match(TokenType.LBRACKET)) {
                expect(TokenType.RBRACKET, "Expected ']' after 'json['");
                jsonArray = true;
            }
            Token block = peek();
            if (!block.is(TokenType.RAW_OBJECT)) {
                throw new SyntaxError("Expected JSON type block after 'json'", block.line(), block.column());
            }
            advance();
            JsonTypeDefinition definition =
                JsonShapeParser.parse(block.value(), jsonArray, block.line(), block.column());
            field.jsonTypeDefinition(definition).array(jsonArray);
        } else if (typeToken.type().isTypeKeyword() || typeToken.is(TokenType.IDENTIFIER)) {
            advance();
            field.fieldType(typeToken.value());
            if (check(TokenType.LBRACKET) && peek(1).is(TokenType.RBRACKET)) {
                advance();
                advance();
                field.array(true);
            }
        } else {
            throw new SyntaxError("Unexpected type '" + typeToken.value() + "'",
                typeToken.line(), typeToken.column());
        }

        while (match(TokenType.AT)) {
            parseDecorator(field);
        }

        return field.build();
    }

    private void parseDecorator(FieldNode.Builder field) throws SyntaxError {
        Token decorator = expect(TokenType.IDENTIFIER, "Expected decorator name");
        String name = decorator.value();

        Optional<RelationType> relationType = RelationType.fromKeyword(name);
        if (relationType.isPresent()) {
            String foreignKey = null;
            if (match(TokenType.LPAREN)) {
                foreignKey = expect(TokenType.IDENTIFIER, "Expected foreign key").value();
                expect(TokenType.RPAREN, "Expected ')' after foreign key");
            }
            field.relation(new Relation(relationType.get(), foreignKey));
            return;
        }

        switch (name) {
            case "primary_key" -> field.primaryKey(true);
            case "unique" -> field.unique(true);
            case "required" -> field.required(true);
            case "default" -> {
                expect(TokenType.LPAREN, "Expected '(' after @default");
                field.defaultValue(parseDefaultValue());
                expect(TokenType.RPAREN, "Expected ')' after @default value");
            }
            default -> throw new SyntaxError("Unknown decorator '@" + name + "'",
                decorator.line(), decorator.column());
        }
    }

    private DefaultValue parseDefaultValue() throws SyntaxError {
        Token value = peek();
        switch (value.type()) {
            case NUMBER_LITERAL -> {
                advance();
                return DefaultValue.number(value.value());
            }
            case STRING_LITERAL -> {
                advance();
                return DefaultValue.string(value.value());
            }
            case IDENTIFIER -> {
                if ("true".equals(value.value()) || "false".equals(value.value())) {
                    advance();
                    return DefaultValue.bool(Boolean.parseBoolean(value.value()));
                }
                Optional<DefaultFunction> function = DefaultFunction.fromName(value.value());
                if (function.isPresent()) {
                    advance();
                    expect(TokenType.LPAREN, "Expected '(' after " + value.value());
                    expect(TokenType.RPAREN, "Expected ')' after " + value.value() + "(");
                    return DefaultValue.function(function.get());
                }
                throw new SyntaxError("Invalid default value '" + value.value() + "'",
                    value.line(), value.column());
            }
            default -> throw new SyntaxError("Invalid default value '" + value.value() + "'",
                value.line(), value.column());
        }
    }

    private Token expect(TokenType type, String message) throws SyntaxError {
        Token token = peek();
        if (token.is(type)) {
            return advance();
        }
        throw new SyntaxError(message, token.line(), token.column());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = current + offset;
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private Token advance() {
        Token token = peek();
        if (current < tokens.size() - 1) {
            current++;
        }
        return token;
    }
}

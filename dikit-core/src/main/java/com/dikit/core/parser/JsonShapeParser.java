package com.dikit.core.parser;

import com.dikit.core.model.JsonField;
import com.dikit.core.model.JsonTypeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the raw block captured after a {@code json} type into a {@link JsonTypeDefinition}.
 *
 * <p>Entry grammar: {@code name ["?"] ":" (type | "{" ... "}") ["[]"] ["?"]}, entries
 * separated by whitespace, commas or semicolons. A block that does not follow this grammar
 * keeps its raw text and gets an empty entry list.
 */
final class JsonShapeParser {

    private static final Logger log = LoggerFactory.getLogger(JsonShapeParser.class);

    private final String raw;
    private int position;

    private JsonShapeParser(String raw) {
        this.raw = raw;
    }

    static JsonTypeDefinition parse(String raw, boolean isArray, int line, int column) {
        List<JsonField> fields;
        try {
            JsonShapeParser parser = new JsonShapeParser(raw);
            fields = parser.parseObject();
            parser.skipSeparators();
            if (parser.position < raw.length()) {
                throw new IllegalArgumentException("trailing text after json block");
            }
        } catch (IllegalArgumentException e) {
            log.warn("Could not read json type block at {}:{} ({}); keeping raw text only",
                line, column, e.getMessage());
            fields = List.of();
        }
        return new JsonTypeDefinition(raw, isArray, fields, line, column);
    }

    private List<JsonField> parseObject() {
        expect('{');
        List<JsonField> fields = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (peek() == '}') {
                position++;
                return fields;
            }
            if (position >= raw.length()) {
                throw new IllegalArgumentException("unterminated block");
            }
            fields.add(parseEntry());
        }
    }

    private JsonField parseEntry() {
        String name = readName();
        skipWhitespace();
        boolean optional = false;
        if (peek() == '?') {
            optional = true;
            position++;
            skipWhitespace();
        }
        expect(':');
        skipWhitespace();

        String type;
        List<JsonField> nested = List.of();
        if (peek() == '{') {
            nested = parseObject();
            type = JsonField.OBJECT;
        } else {
            type = readName();
        }

        skipWhitespace();
        boolean isArray = false;
        if (peek() == '[') {
            position++;
            skipWhitespace();
            expect(']');
            isArray = true;
            skipWhitespace();
        }
        if (peek() == '?') {
            optional = true;
            position++;
        }
        return new JsonField(name, optional, type, isArray, nested);
    }

    private String readName() {
        int start = position;
        while (position < raw.length()
            && (Character.isLetterOrDigit(raw.charAt(position)) || raw.charAt(position) == '_')) {
            position++;
        }
        if (start == position) {
            throw new IllegalArgumentException("expected a name at offset " + position);
        }
        return raw.substring(start, position);
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw new IllegalArgumentException("expected '" + expected + "' at offset " + position);
        }
        position++;
    }

    private void skipWhitespace() {
        while (position < raw.length() && Character.isWhitespace(raw.charAt(position))) {
            position++;
        }
    }

    private void skipSeparators() {
        while (position < raw.length()) {
            char c = raw.charAt(position);
            if (Character.isWhitespace(c) || c == ',' || c == ';') {
                position++;
            } else {
                break;
            }
        }
    }

    private char peek() {
        return position < raw.length() ? raw.charAt(position) : '\0';
    }
}

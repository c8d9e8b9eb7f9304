package com.dikit.core.model;

import java.util.Objects;

/**
 * Default value of a field: either a literal or a function call, never both.
 *
 * <p>The hierarchy is closed so that every consumer handles exactly these two shapes.
 * Literal values keep their source text; numbers are compared textually so that a value
 * read back from a database catalog equals the value written in schema source.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DefaultValue zero = DefaultValue.number("0");
 * DefaultValue created = DefaultValue.function(DefaultFunction.NOW);
 * }</pre>
 */
public sealed interface DefaultValue permits DefaultValue.Literal, DefaultValue.FunctionCall {

    /**
     * Literal kinds.
     */
    enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        /** Database expression kept verbatim (only produced by introspection). */
        EXPRESSION
    }

    /**
     * A literal default.
     *
     * @param kind literal kind
     * @param text literal text without quotes
     */
    record Literal(LiteralKind kind, String text) implements DefaultValue {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * A zero-argument function call default.
     *
     * @param function the function
     */
    record FunctionCall(DefaultFunction function) implements DefaultValue {
        public FunctionCall {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    static DefaultValue number(String text) {
        return new Literal(LiteralKind.NUMBER, text);
    }

    static DefaultValue string(String text) {
        return new Literal(LiteralKind.STRING, text);
    }

    static DefaultValue bool(boolean value) {
        return new Literal(LiteralKind.BOOLEAN, Boolean.toString(value));
    }

    static DefaultValue expression(String text) {
        return new Literal(LiteralKind.EXPRESSION, text);
    }

    static DefaultValue function(DefaultFunction function) {
        return new FunctionCall(function);
    }

    /**
     * Returns true if this is a call to the given function.
     *
     * @param function function to test for
     * @return whether this default calls {@code function}
     */
    default boolean isCall(DefaultFunction function) {
        return this instanceof FunctionCall call && call.function() == function;
    }
}

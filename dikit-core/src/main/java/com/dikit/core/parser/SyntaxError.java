package com.dikit.core.parser;

/**
 * A syntax error at a source position.
 *
 * <p>Checked on purpose: inside the parser it is the signal that the current model is
 * malformed, and the model loop is the only place that handles it (by resynchronizing at
 * the next {@code model} keyword). Everything that escapes a model ends up in
 * {@link ParseResult#errors()}.
 */
public class SyntaxError extends Exception {

    private final String detail;
    private final int line;
    private final int column;

    public SyntaxError(String detail, int line, int column) {
        super("Syntax Error at [" + line + ":" + column + "]: " + detail);
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    /**
     * Returns the message without the position prefix.
     *
     * @return bare error description
     */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

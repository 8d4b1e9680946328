package com.flowgraph.document;

import java.util.Objects;

/**
 * Why a document text failed to parse, with the 1-based position reported by the JSON parser
 * ({@code line}/{@code column} are 0 when no position is known).
 */
public final class ParseError {

    private final String message;
    private final int line;
    private final int column;

    public ParseError(String message, int line, int column) {
        this.message = Objects.requireNonNull(message, "message");
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseError that = (ParseError) o;
        return line == that.line && column == that.column && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, line, column);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + ": " + message;
    }
}

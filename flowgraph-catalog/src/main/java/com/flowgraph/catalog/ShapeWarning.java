package com.flowgraph.catalog;

import java.util.Objects;

/**
 * A parameter that does not match its declared shape. Informational only; entries are never
 * rejected because of it.
 */
public final class ShapeWarning {

    public enum Kind {
        MISSING_REQUIRED,
        TYPE_MISMATCH
    }

    private final String parameter;
    private final Kind kind;
    private final String message;

    public ShapeWarning(String parameter, Kind kind, String message) {
        this.parameter = parameter;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
    }

    public String getParameter() {
        return parameter;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShapeWarning that = (ShapeWarning) o;
        return Objects.equals(parameter, that.parameter) && kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, kind, message);
    }

    @Override
    public String toString() {
        return message;
    }
}

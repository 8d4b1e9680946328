package com.flowgraph.document.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Objects;

/**
 * Global pipeline settings: an open JSON object. Unknown keys are kept verbatim;
 * {@code runOnce}, {@code onlyFetch} and {@code onlyGenerate} have typed accessors.
 */
public final class Settings {

    public static final Settings EMPTY = new Settings(Map.of());

    private final Map<String, Object> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Settings(Map<String, Object> values) {
        this.values = ParamValues.copyOf(values);
    }

    @JsonValue
    public Map<String, Object> getValues() {
        return values;
    }

    public boolean isRunOnce() {
        return flag("runOnce");
    }

    public boolean isOnlyFetch() {
        return flag("onlyFetch");
    }

    public boolean isOnlyGenerate() {
        return flag("onlyGenerate");
    }

    public Object get(String key) {
        return values.get(key);
    }

    private boolean flag(String key) {
        Object v = values.get(key);
        return v instanceof Boolean ? (Boolean) v : v instanceof String && Boolean.parseBoolean((String) v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(values, ((Settings) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Settings" + values;
    }
}

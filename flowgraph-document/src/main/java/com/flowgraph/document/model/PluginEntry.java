package com.flowgraph.document.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One plugin configuration record inside a role array of a {@link ConfigDocument}:
 * {@code { "type"?, "name", "params", "interval"? }}.
 * <p>
 * When {@code params.children} is a non-empty list of entry objects (each with a {@code name} or
 * {@code params}), it is exposed as {@link #getChildren()} and kept out of {@link #getParams()}; any
 * other {@code children} value stays a plain parameter.
 * <p>
 * Every entry has an internal {@link #getKey() key} that identifies it across index shifts. The key
 * is never serialized and does not take part in {@link #equals(Object)}.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class PluginEntry {

    public static final String CHILDREN_KEY = "children";

    private final String key;
    private final String type;
    private final String name;
    private final Map<String, Object> params;
    private final List<PluginEntry> children;
    private final Long interval;

    @JsonCreator
    public PluginEntry(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("interval") Long interval) {
        this(null, type, name, params, null, interval);
    }

    private PluginEntry(String key, String type, String name, Map<String, ?> params,
                        List<PluginEntry> children, Long interval) {
        this.key = key;
        this.type = type;
        this.name = name;
        List<PluginEntry> nested = children != null ? children : nestedEntries(params);
        if (nested.isEmpty()) {
            this.params = ParamValues.copyOf(params);
            this.children = List.of();
        } else {
            Map<String, Object> rest = ParamValues.mutableCopy(params);
            rest.remove(CHILDREN_KEY);
            this.params = Collections.unmodifiableMap(rest);
            this.children = List.copyOf(nested);
        }
        this.interval = interval;
    }

    public static PluginEntry of(String name, Map<String, ?> params) {
        return new PluginEntry(null, null, name, params, null, null);
    }

    public static PluginEntry of(String type, String name, Map<String, ?> params, Long interval) {
        return new PluginEntry(null, type, name, params, null, interval);
    }

    /** Stable internal identity; null until assigned (see {@link ConfigDocument#withEntryKeys()}). */
    public String getKey() {
        return key;
    }

    /** Plugin implementation name (e.g. {@code RSSSource}); optional. */
    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Parameters without nested child entries. Unmodifiable; may contain null values. */
    public Map<String, Object> getParams() {
        return params;
    }

    /** Nested child entries of a composite plugin ({@code params.children}). */
    public List<PluginEntry> getChildren() {
        return children;
    }

    /** Optional run interval in milliseconds. */
    @JsonProperty("interval")
    public Long getInterval() {
        return interval;
    }

    /** Wire form of {@code params}: parameters plus {@code children} when nested entries exist. */
    @JsonProperty("params")
    public Map<String, Object> getWireParams() {
        if (children.isEmpty()) return params;
        Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.put(CHILDREN_KEY, children);
        return merged;
    }

    public PluginEntry withKey(String key) {
        return new PluginEntry(key, type, name, params, children, interval);
    }

    /** Returns a copy with a new random key if this entry has none. */
    public PluginEntry withEnsuredKey() {
        return key != null ? this : withKey(UUID.randomUUID().toString());
    }

    public PluginEntry withName(String name) {
        return new PluginEntry(key, type, name, params, children, interval);
    }

    /**
     * Returns a copy with the given wire-form params; nested entries are taken from
     * {@code params.children} again, so a map without {@code children} drops them.
     */
    public PluginEntry withParams(Map<String, ?> params) {
        return new PluginEntry(key, type, name, params, null, interval);
    }

    public PluginEntry withInterval(Long interval) {
        return new PluginEntry(key, type, name, params, children, interval);
    }

    public PluginEntry withChildren(List<PluginEntry> children) {
        return new PluginEntry(key, type, name, params, children != null ? children : List.of(), interval);
    }

    /** Returns a copy without parameter {@code paramKey}, or this entry when it is absent. */
    public PluginEntry withoutParam(String paramKey) {
        if (!params.containsKey(paramKey)) return this;
        Map<String, Object> updated = new LinkedHashMap<>(params);
        updated.remove(paramKey);
        return new PluginEntry(key, type, name, updated, children, interval);
    }

    /** Returns a copy with {@code paramKey} set to {@code value}, or this entry when already equal. */
    public PluginEntry withParam(String paramKey, Object value) {
        if (params.containsKey(paramKey) && Objects.equals(params.get(paramKey), value)) return this;
        Map<String, Object> updated = new LinkedHashMap<>(params);
        updated.put(paramKey, value);
        return new PluginEntry(key, type, name, updated, children, interval);
    }

    private static List<PluginEntry> nestedEntries(Map<String, ?> params) {
        if (params == null) return List.of();
        Object raw = params.get(CHILDREN_KEY);
        if (!(raw instanceof List) || ((List<?>) raw).isEmpty()) return List.of();
        List<PluginEntry> out = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (item instanceof PluginEntry) {
                out.add((PluginEntry) item);
            } else if (item instanceof Map && isEntryShaped((Map<?, ?>) item)) {
                out.add(fromMap((Map<?, ?>) item));
            } else {
                return List.of();
            }
        }
        return out;
    }

    private static boolean isEntryShaped(Map<?, ?> map) {
        return map.get("name") instanceof String || map.get("params") instanceof Map;
    }

    @SuppressWarnings("unchecked")
    private static PluginEntry fromMap(Map<?, ?> map) {
        Object type = map.get("type");
        Object name = map.get("name");
        Object params = map.get("params");
        Object interval = map.get("interval");
        return new PluginEntry(
                null,
                type instanceof String ? (String) type : null,
                name instanceof String ? (String) name : null,
                params instanceof Map ? (Map<String, Object>) params : Map.of(),
                null,
                interval instanceof Number ? ((Number) interval).longValue() : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginEntry that = (PluginEntry) o;
        return Objects.equals(type, that.type)
                && Objects.equals(name, that.name)
                && Objects.equals(params, that.params)
                && Objects.equals(children, that.children)
                && Objects.equals(interval, that.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, params, children, interval);
    }

    @Override
    public String toString() {
        return "PluginEntry{name=" + name + ", type=" + type + ", params=" + params
                + (children.isEmpty() ? "" : ", children=" + children) + "}";
    }
}

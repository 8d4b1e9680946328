package com.flowgraph.document.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for JSON-shaped parameter values (scalars, lists, maps, null).
 * Copies are deep and unmodifiable; unlike {@link Map#copyOf} null values and key order are kept,
 * since {@code "provider": null} and absence of the key are both meaningful to callers.
 */
public final class ParamValues {

    private ParamValues() {
    }

    /** Deep, unmodifiable, order-preserving copy of a parameter map. Null yields an empty map. */
    public static Map<String, Object> copyOf(Map<String, ?> params) {
        if (params == null || params.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : params.entrySet()) {
            if (e.getKey() == null) continue;
            copy.put(e.getKey(), copyValue(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /** Mutable deep copy, for callers that build a modified map before wrapping it again. */
    public static Map<String, Object> mutableCopy(Map<String, ?> params) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (k != null) copy.put(k, copyValue(v));
            });
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof PluginEntry) {
            return value;
        }
        if (value instanceof Map) {
            return copyOf((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<?>) value) {
                list.add(copyValue(item));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }
}

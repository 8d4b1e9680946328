package com.flowgraph.document.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Category of a plugin entry in a {@link ConfigDocument}. JSON uses the document array key
 * ({@code sources}, {@code ai}, ...); singular forms such as {@code source} are accepted on read.
 * <p>
 * Grouped roles are rendered as leaf children of one synthetic group node per role; the others are
 * top-level leaves in the left column. Only grouped roles carry reference-valued parameters.
 */
public enum Role {
    SOURCES("sources", "source", "Sources", true),
    ENRICHERS("enrichers", "enricher", "Enrichers", true),
    GENERATORS("generators", "generator", "Generators", true),
    AI("ai", "ai", "AI Providers", false),
    STORAGE("storage", "storage", "Storage", false);

    /** Order in which the graph is laid out and node ids are assigned. */
    public static final List<Role> LAYOUT_ORDER = List.of(STORAGE, AI, SOURCES, ENRICHERS, GENERATORS);

    private final String jsonKey;
    private final String nodePrefix;
    private final String groupDisplayName;
    private final boolean grouped;

    Role(String jsonKey, String nodePrefix, String groupDisplayName, boolean grouped) {
        this.jsonKey = jsonKey;
        this.nodePrefix = nodePrefix;
        this.groupDisplayName = groupDisplayName;
        this.grouped = grouped;
    }

    @JsonValue
    public String getJsonKey() {
        return jsonKey;
    }

    /** Prefix of positional leaf ids, e.g. {@code source} in {@code source-2}. */
    public String getNodePrefix() {
        return nodePrefix;
    }

    public String getGroupDisplayName() {
        return groupDisplayName;
    }

    public boolean isGrouped() {
        return grouped;
    }

    /** Entries of this role may reference {@code ai} and {@code storage} entries by name. */
    public boolean acceptsReferences() {
        return grouped;
    }

    /** Id of the synthetic group node, e.g. {@code sources-group}; null for top-level roles. */
    public String groupNodeId() {
        return grouped ? jsonKey + "-group" : null;
    }

    /** Positional node id for the entry at {@code index}. */
    public String nodeId(int index) {
        return nodePrefix + "-" + index;
    }

    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toLowerCase();
        for (Role r : values()) {
            if (r.jsonKey.equals(normalized) || r.nodePrefix.equals(normalized)) return r;
        }
        return null;
    }
}

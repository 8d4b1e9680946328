package com.flowgraph.document.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Canonical pipeline configuration: a name, one ordered entry list per {@link Role} and global
 * {@link Settings}. Immutable; every {@code with*} call returns a new document.
 * <p>
 * Older documents that carry a {@code providers} array instead of {@code ai} are read with those
 * entries as {@code ai}. A missing name becomes {@value #DEFAULT_NAME}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "sources", "enrichers", "generators", "ai", "storage", "settings"})
public final class ConfigDocument {

    public static final String DEFAULT_NAME = "default";

    private final String name;
    private final Map<Role, List<PluginEntry>> entries;
    private final Settings settings;

    @JsonCreator
    public ConfigDocument(
            @JsonProperty("name") String name,
            @JsonProperty("sources") List<PluginEntry> sources,
            @JsonProperty("enrichers") List<PluginEntry> enrichers,
            @JsonProperty("generators") List<PluginEntry> generators,
            @JsonProperty("ai") List<PluginEntry> ai,
            @JsonProperty("storage") List<PluginEntry> storage,
            @JsonProperty("settings") Settings settings,
            @JsonProperty("providers") List<PluginEntry> legacyProviders) {
        this.name = name != null && !name.isBlank() ? name : DEFAULT_NAME;
        Map<Role, List<PluginEntry>> byRole = new EnumMap<>(Role.class);
        byRole.put(Role.SOURCES, copy(sources));
        byRole.put(Role.ENRICHERS, copy(enrichers));
        byRole.put(Role.GENERATORS, copy(generators));
        byRole.put(Role.AI, ai != null ? copy(ai) : copy(legacyProviders));
        byRole.put(Role.STORAGE, copy(storage));
        this.entries = byRole;
        this.settings = settings != null ? settings : Settings.EMPTY;
    }

    private ConfigDocument(String name, Map<Role, List<PluginEntry>> entries, Settings settings) {
        this.name = name;
        this.entries = entries;
        this.settings = settings;
    }

    /** Empty document with the given name. */
    public static ConfigDocument empty(String name) {
        return new ConfigDocument(name, null, null, null, null, null, null, null);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<PluginEntry> getSources() {
        return entries.get(Role.SOURCES);
    }

    public List<PluginEntry> getEnrichers() {
        return entries.get(Role.ENRICHERS);
    }

    public List<PluginEntry> getGenerators() {
        return entries.get(Role.GENERATORS);
    }

    public List<PluginEntry> getAi() {
        return entries.get(Role.AI);
    }

    public List<PluginEntry> getStorage() {
        return entries.get(Role.STORAGE);
    }

    public Settings getSettings() {
        return settings;
    }

    /** Entries of {@code role} in document order (unmodifiable). */
    public List<PluginEntry> entries(Role role) {
        return entries.get(Objects.requireNonNull(role, "role"));
    }

    /** Index of the entry with stable key {@code key} in {@code role}, or -1. */
    public int indexOfKey(Role role, String key) {
        if (key == null) return -1;
        List<PluginEntry> list = entries(role);
        for (int i = 0; i < list.size(); i++) {
            if (key.equals(list.get(i).getKey())) return i;
        }
        return -1;
    }

    public boolean hasNoEntries() {
        return entries.values().stream().allMatch(List::isEmpty);
    }

    public ConfigDocument withName(String name) {
        return new ConfigDocument(name != null && !name.isBlank() ? name : DEFAULT_NAME, entries, settings);
    }

    public ConfigDocument withSettings(Settings settings) {
        return new ConfigDocument(name, entries, settings != null ? settings : Settings.EMPTY);
    }

    /** Returns a new document whose {@code role} list is {@code list}. */
    public ConfigDocument withEntries(Role role, List<PluginEntry> list) {
        Map<Role, List<PluginEntry>> updated = new EnumMap<>(entries);
        updated.put(Objects.requireNonNull(role, "role"), copy(list));
        return new ConfigDocument(name, updated, settings);
    }

    /** Returns a new document with the entry at {@code index} of {@code role} replaced. */
    public ConfigDocument withEntry(Role role, int index, PluginEntry entry) {
        List<PluginEntry> list = new ArrayList<>(entries(role));
        list.set(index, Objects.requireNonNull(entry, "entry"));
        return withEntries(role, list);
    }

    /** Returns a new document with {@code entry} appended to {@code role}. */
    public ConfigDocument withAddedEntry(Role role, PluginEntry entry) {
        List<PluginEntry> list = new ArrayList<>(entries(role));
        list.add(Objects.requireNonNull(entry, "entry"));
        return withEntries(role, list);
    }

    /** Returns a new document without the entry at {@code index} of {@code role}; later entries shift down. */
    public ConfigDocument withoutEntry(Role role, int index) {
        List<PluginEntry> list = new ArrayList<>(entries(role));
        list.remove(index);
        return withEntries(role, list);
    }

    /** True when some top-level entry of any role carries stable key {@code key}. */
    public boolean usesKey(String key) {
        if (key == null) return false;
        for (Role role : Role.values()) {
            if (indexOfKey(role, key) >= 0) return true;
        }
        return false;
    }

    /**
     * Returns a document where every top-level entry has a stable key that no other entry shares;
     * entries that already have a unique key keep it, later duplicates get a fresh one. Returns this
     * document when nothing changed.
     */
    public ConfigDocument withEntryKeys() {
        Map<Role, List<PluginEntry>> updated = new EnumMap<>(Role.class);
        Set<String> seen = new HashSet<>();
        boolean changed = false;
        for (Map.Entry<Role, List<PluginEntry>> e : entries.entrySet()) {
            List<PluginEntry> keyed = new ArrayList<>(e.getValue().size());
            for (PluginEntry entry : e.getValue()) {
                PluginEntry ensured = entry.getKey() != null && seen.contains(entry.getKey())
                        ? entry.withKey(UUID.randomUUID().toString())
                        : entry.withEnsuredKey();
                seen.add(ensured.getKey());
                changed |= ensured != entry;
                keyed.add(ensured);
            }
            updated.put(e.getKey(), List.copyOf(keyed));
        }
        return changed ? new ConfigDocument(name, updated, settings) : this;
    }

    private static List<PluginEntry> copy(List<PluginEntry> list) {
        if (list == null || list.isEmpty()) return List.of();
        List<PluginEntry> out = new ArrayList<>(list.size());
        for (PluginEntry entry : list) {
            if (entry != null) out.add(entry);
        }
        return List.copyOf(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigDocument that = (ConfigDocument) o;
        return Objects.equals(name, that.name)
                && Objects.equals(entries, that.entries)
                && Objects.equals(settings, that.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entries, settings);
    }

    @Override
    public String toString() {
        return "ConfigDocument{name=" + name + ", entries=" + entries + ", settings=" + settings + "}";
    }

    /** Fluent construction, mostly for tests and programmatic documents. */
    public static final class Builder {
        private final String name;
        private final Map<Role, List<PluginEntry>> entries = new EnumMap<>(Role.class);
        private Settings settings = Settings.EMPTY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder add(Role role, PluginEntry entry) {
            entries.computeIfAbsent(role, r -> new ArrayList<>()).add(entry);
            return this;
        }

        public Builder add(Role role, String entryName, Map<String, ?> params) {
            return add(role, PluginEntry.of(entryName, params));
        }

        public Builder settings(Settings settings) {
            this.settings = settings;
            return this;
        }

        public ConfigDocument build() {
            return new ConfigDocument(name,
                    entries.get(Role.SOURCES),
                    entries.get(Role.ENRICHERS),
                    entries.get(Role.GENERATORS),
                    entries.get(Role.AI),
                    entries.get(Role.STORAGE),
                    settings,
                    null);
        }
    }
}

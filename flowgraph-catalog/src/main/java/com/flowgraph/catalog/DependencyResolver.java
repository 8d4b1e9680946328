package com.flowgraph.catalog;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Works out the shared plugins a new plugin depends on. A constructor parameter whose type mentions
 * {@code provider} (e.g. {@code AIProvider}) or whose name is {@code provider} needs an {@code ai}
 * entry; likewise {@code storage}/{@code StoragePlugin} needs a {@code storage} entry. The first
 * existing entry of the role is reused; otherwise a default entry is planned.
 * <p>
 * Only plugins of roles that hold references ({@link Role#acceptsReferences()}) have dependencies;
 * {@code ai} and {@code storage} plugins never get a provider or storage wired in.
 */
public final class DependencyResolver {

    public static final PluginEntry DEFAULT_PROVIDER = PluginEntry.of(
            "OpenAIProvider", "OpenAIProvider", Map.of("model", "gpt-4o-mini"), null);
    public static final PluginEntry DEFAULT_STORAGE = PluginEntry.of(
            "SQLiteStorage", "SQLiteStorage", Map.of("dbPath", "./data/content.db"), null);

    private final PluginEntry defaultProvider;
    private final PluginEntry defaultStorage;

    public DependencyResolver() {
        this(DEFAULT_PROVIDER, DEFAULT_STORAGE);
    }

    /**
     * @param defaultProvider entry created when a provider is needed and the document has none
     * @param defaultStorage  entry created when storage is needed and the document has none
     */
    public DependencyResolver(PluginEntry defaultProvider, PluginEntry defaultStorage) {
        this.defaultProvider = Objects.requireNonNull(defaultProvider, "defaultProvider");
        this.defaultStorage = Objects.requireNonNull(defaultStorage, "defaultStorage");
    }

    public DependencyRequirements requirements(PluginDescriptor descriptor) {
        if (descriptor == null) return DependencyRequirements.NONE;
        if (descriptor.getRole() != null && !descriptor.getRole().acceptsReferences()) {
            return DependencyRequirements.NONE;
        }
        boolean provider = false;
        boolean storage = false;
        for (ParameterDef param : descriptor.getConstructorParameters()) {
            String type = param.getType() != null ? param.getType().toLowerCase(Locale.ROOT) : "";
            String name = param.getName() != null ? param.getName().toLowerCase(Locale.ROOT) : "";
            if (type.contains("provider") || name.equals("provider")) {
                provider = true;
            }
            if (type.contains("storage") || name.equals("storage")) {
                storage = true;
            }
        }
        return new DependencyRequirements(provider, storage);
    }

    /** Plans the dependencies of {@code descriptor} against the current document. */
    public DependencyPlan plan(ConfigDocument document, PluginDescriptor descriptor) {
        DependencyRequirements req = requirements(descriptor);
        PluginEntry providerToAdd = null;
        PluginEntry storageToAdd = null;
        String providerName = null;
        String storageName = null;
        if (req.needsProvider()) {
            providerName = firstName(document, Role.AI);
            if (providerName == null) {
                providerToAdd = defaultProvider;
                providerName = defaultProvider.getName();
            }
        }
        if (req.needsStorage()) {
            storageName = firstName(document, Role.STORAGE);
            if (storageName == null) {
                storageToAdd = defaultStorage;
                storageName = defaultStorage.getName();
            }
        }
        return new DependencyPlan(req, providerToAdd, storageToAdd, providerName, storageName);
    }

    private static String firstName(ConfigDocument document, Role role) {
        if (document == null) return null;
        for (PluginEntry entry : document.entries(role)) {
            if (entry.getName() != null && !entry.getName().isBlank()) return entry.getName();
        }
        return null;
    }
}

package com.flowgraph.catalog;

import com.flowgraph.document.model.PluginEntry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What adding a plugin takes: default {@code ai}/{@code storage} entries to create first (null when
 * an existing one is reused or none is needed) and the names to pre-fill into the new entry's
 * {@code provider}/{@code storage} params.
 */
public final class DependencyPlan {

    private final DependencyRequirements requirements;
    private final PluginEntry providerToAdd;
    private final PluginEntry storageToAdd;
    private final String providerName;
    private final String storageName;

    public DependencyPlan(DependencyRequirements requirements, PluginEntry providerToAdd, PluginEntry storageToAdd,
                          String providerName, String storageName) {
        this.requirements = requirements;
        this.providerToAdd = providerToAdd;
        this.storageToAdd = storageToAdd;
        this.providerName = providerName;
        this.storageName = storageName;
    }

    public DependencyRequirements getRequirements() {
        return requirements;
    }

    /** New {@code ai} entry to append before the plugin itself, or null. */
    public PluginEntry getProviderToAdd() {
        return providerToAdd;
    }

    /** New {@code storage} entry to append before the plugin itself, or null. */
    public PluginEntry getStorageToAdd() {
        return storageToAdd;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getStorageName() {
        return storageName;
    }

    /** Reference params to merge into the new entry: {@code provider} and/or {@code storage}. */
    public Map<String, Object> dependencyParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (requirements.needsProvider() && providerName != null) {
            params.put("provider", providerName);
        }
        if (requirements.needsStorage() && storageName != null) {
            params.put("storage", storageName);
        }
        return params;
    }
}

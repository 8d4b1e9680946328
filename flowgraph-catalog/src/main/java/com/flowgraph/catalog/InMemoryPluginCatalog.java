package com.flowgraph.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.document.model.Role;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Catalog held in memory, keyed by role and implementation name. Populate with
 * {@link #register(PluginDescriptor)} or load a JSON array of descriptors with {@link #fromJson(String)}.
 */
public final class InMemoryPluginCatalog implements PluginCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<PluginDescriptor>> LIST_TYPE = new TypeReference<>() {};

    /** role → descriptors in registration order */
    private final Map<Role, List<PluginDescriptor>> byRole = new ConcurrentHashMap<>();

    /**
     * Registers a descriptor.
     *
     * @throws IllegalArgumentException if the role or plugin name is missing, or the plugin name is
     *                                  already registered for that role
     */
    public synchronized void register(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.getRole() == null) {
            throw new IllegalArgumentException("Plugin role must be set: " + descriptor.getName());
        }
        String pluginName = descriptor.getPluginName();
        if (pluginName == null || pluginName.isBlank()) {
            throw new IllegalArgumentException("Plugin name must be non-blank");
        }
        List<PluginDescriptor> list = byRole.computeIfAbsent(descriptor.getRole(), r -> new CopyOnWriteArrayList<>());
        for (PluginDescriptor existing : list) {
            if (pluginName.equals(existing.getPluginName())) {
                throw new IllegalArgumentException("Plugin already registered for role "
                        + descriptor.getRole().getJsonKey() + ": " + pluginName);
            }
        }
        list.add(descriptor);
    }

    @Override
    public CategorizedPluginDescriptors listPlugins() {
        Map<Role, List<PluginDescriptor>> snapshot = new EnumMap<>(Role.class);
        byRole.forEach((role, list) -> snapshot.put(role, new ArrayList<>(list)));
        return new CategorizedPluginDescriptors(snapshot);
    }

    /**
     * Builds a catalog from a JSON array of descriptors.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static InMemoryPluginCatalog fromJson(String json) {
        try {
            return of(MAPPER.readValue(json, LIST_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Builds a catalog from a classpath resource holding a JSON array of descriptors. */
    public static InMemoryPluginCatalog fromResource(String resource) {
        try (InputStream in = InMemoryPluginCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Catalog resource not found: " + resource));
            }
            return of(MAPPER.readValue(in, LIST_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static InMemoryPluginCatalog of(List<PluginDescriptor> descriptors) {
        InMemoryPluginCatalog catalog = new InMemoryPluginCatalog();
        if (descriptors != null) {
            descriptors.forEach(catalog::register);
        }
        return catalog;
    }
}

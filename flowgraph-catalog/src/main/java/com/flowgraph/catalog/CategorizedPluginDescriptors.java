package com.flowgraph.catalog;

import com.flowgraph.document.model.Role;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the plugin catalog grouped by {@link Role}, in registration order per role.
 */
public final class CategorizedPluginDescriptors {

    private final Map<Role, List<PluginDescriptor>> byRole;

    public CategorizedPluginDescriptors(Map<Role, List<PluginDescriptor>> byRole) {
        Map<Role, List<PluginDescriptor>> copy = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            List<PluginDescriptor> list = byRole != null ? byRole.get(role) : null;
            copy.put(role, list != null ? List.copyOf(list) : List.of());
        }
        this.byRole = copy;
    }

    public List<PluginDescriptor> forRole(Role role) {
        return byRole.get(role);
    }

    /** All descriptors, role by role in {@link Role} declaration order. */
    public List<PluginDescriptor> all() {
        List<PluginDescriptor> out = new ArrayList<>();
        byRole.values().forEach(out::addAll);
        return out;
    }

    /** Visible descriptors only (hidden plugins stay usable but are not offered). */
    public List<PluginDescriptor> visible(Role role) {
        return forRole(role).stream().filter(d -> !d.isHidden()).toList();
    }

    /** Descriptor with the given implementation name in {@code role}. */
    public Optional<PluginDescriptor> find(Role role, String pluginName) {
        if (pluginName == null) return Optional.empty();
        return forRole(role).stream().filter(d -> pluginName.equals(d.getPluginName())).findFirst();
    }

    /** Descriptor with the given implementation name in any role. */
    public Optional<PluginDescriptor> find(String pluginName) {
        if (pluginName == null) return Optional.empty();
        return all().stream().filter(d -> pluginName.equals(d.getPluginName())).findFirst();
    }

    public int size() {
        return byRole.values().stream().mapToInt(List::size).sum();
    }
}

package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.document.model.Settings;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a document back out of a graph: one entry per leaf, ordered by the index in its positional
 * id, with the leaf's display name, plugin type, params and interval. Used to check that the two
 * views agree.
 */
public final class DocumentProjection {

    private DocumentProjection() {
    }

    public static ConfigDocument toDocument(GraphModel graph, String name, Settings settings) {
        Map<Role, List<Node>> byRole = new EnumMap<>(Role.class);
        for (Node leaf : graph.leaves()) {
            if (leaf.getRole() != null) {
                byRole.computeIfAbsent(leaf.getRole(), r -> new ArrayList<>()).add(leaf);
            }
        }
        ConfigDocument doc = ConfigDocument.empty(name).withSettings(settings);
        for (Map.Entry<Role, List<Node>> e : byRole.entrySet()) {
            List<Node> leaves = e.getValue();
            leaves.sort(Comparator.comparingInt(DocumentProjection::positionalIndex));
            List<PluginEntry> entries = new ArrayList<>(leaves.size());
            for (Node leaf : leaves) {
                entries.add(PluginEntry.of(leaf.getPluginType(), leaf.getDisplayName(), leaf.getParams(), leaf.getInterval())
                        .withKey(leaf.getEntryKey()));
            }
            doc = doc.withEntries(e.getKey(), entries);
        }
        return doc;
    }

    private static int positionalIndex(Node leaf) {
        String id = leaf.getId();
        int dash = id.lastIndexOf('-');
        try {
            return Integer.parseInt(id.substring(dash + 1));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}

package com.flowgraph.engine.reference;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Maps reference values to entries and connections to reference values. Pure lookups against the
 * document or graph passed in; nothing is cached, since indices shift on every insert or delete.
 */
public final class ReferenceResolver {

    private ReferenceResolver() {
    }

    /**
     * Index of the first entry of {@code role} named {@code name}. Duplicate names always bind to
     * the first match.
     */
    public static OptionalInt resolveByName(ConfigDocument document, Role role, String name) {
        if (document == null || role == null || name == null) return OptionalInt.empty();
        List<PluginEntry> entries = document.entries(role);
        for (int i = 0; i < entries.size(); i++) {
            if (name.equals(entries.get(i).getName())) return OptionalInt.of(i);
        }
        return OptionalInt.empty();
    }

    /** Positional node id of the entry {@code kind} resolves {@code name} to. */
    public static Optional<String> resolveNodeId(ConfigDocument document, ReferenceKind kind, String name) {
        OptionalInt index = resolveByName(document, kind.getTargetRole(), name);
        return index.isPresent() ? Optional.of(kind.getTargetRole().nodeId(index.getAsInt())) : Optional.empty();
    }

    /**
     * The value a connection writes into its target parameter: the current display name of the
     * source node. Empty when the source is missing or unnamed.
     */
    public static Optional<String> nameForConnection(GraphModel graph, Connection connection) {
        if (graph == null || connection == null) return Optional.empty();
        return graph.findNode(connection.getFrom().getNodeId())
                .map(Node::getDisplayName)
                .filter(name -> !name.isBlank());
    }

    /** Every reference value in the document, nested children included, that names no entry. */
    public static List<ReferenceWarning> findDanglingReferences(ConfigDocument document) {
        List<ReferenceWarning> warnings = new ArrayList<>();
        if (document == null) return warnings;
        for (Role role : Role.LAYOUT_ORDER) {
            if (!role.acceptsReferences()) continue;
            List<PluginEntry> entries = document.entries(role);
            for (int i = 0; i < entries.size(); i++) {
                PluginEntry entry = entries.get(i);
                collectDangling(document, role, i, entry.getName(), null, entry, warnings);
            }
        }
        return warnings;
    }

    private static void collectDangling(ConfigDocument document, Role role, int index, String topName,
                                        String childPath, PluginEntry entry, List<ReferenceWarning> out) {
        for (ReferenceKind kind : ReferenceKind.values()) {
            String value = kind.valueIn(entry.getParams());
            if (value != null && resolveByName(document, kind.getTargetRole(), value).isEmpty()) {
                out.add(new ReferenceWarning(role, index, topName, childPath, kind, value));
            }
        }
        List<PluginEntry> children = entry.getChildren();
        for (int c = 0; c < children.size(); c++) {
            String path = (childPath != null ? childPath + "." : "") + "children[" + c + "]";
            collectDangling(document, role, index, topName, path, children.get(c), out);
        }
    }
}

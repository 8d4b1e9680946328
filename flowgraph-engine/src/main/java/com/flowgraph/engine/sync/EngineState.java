package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One converged snapshot of both views: the canonical document and the graph derived from it.
 * Equality is by content, so an edit that reproduces the current state is detectable.
 */
public record EngineState(ConfigDocument document, GraphModel graph) {

    public EngineState {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(graph, "graph");
    }

    /**
     * Index of the entry mirrored by leaf {@code node}: looked up by entry key, falling back to the
     * index encoded in the positional id. -1 when the node mirrors no entry.
     */
    public int entryIndex(Node node) {
        if (node == null || !node.isLeaf() || node.getRole() == null) return -1;
        Role role = node.getRole();
        int byKey = document.indexOfKey(role, node.getEntryKey());
        if (byKey >= 0) return byKey;
        String prefix = role.getNodePrefix() + "-";
        if (!node.getId().startsWith(prefix)) return -1;
        try {
            int index = Integer.parseInt(node.getId().substring(prefix.length()));
            return index >= 0 && index < document.entries(role).size() ? index : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Entry mirrored by leaf {@code node}. */
    public Optional<PluginEntry> entryFor(Node node) {
        int index = entryIndex(node);
        return index < 0 ? Optional.empty() : Optional.of(document.entries(node.getRole()).get(index));
    }

    public Optional<Node> leaf(String nodeId) {
        return graph.findNode(nodeId).filter(Node::isLeaf);
    }

    /**
     * Writes {@code entry} over the entry mirrored by leaf {@code node} and mirrors it back onto the
     * node, so document and graph never disagree on names or params.
     */
    public EngineState withEntry(Node node, PluginEntry entry) {
        int index = entryIndex(node);
        if (index < 0) {
            throw new IllegalArgumentException("Node " + node.getId() + " mirrors no entry");
        }
        PluginEntry current = document.entries(node.getRole()).get(index);
        if (current.equals(entry) && Objects.equals(current.getKey(), entry.getKey())) return this;
        ConfigDocument doc = document.withEntry(node.getRole(), index, entry);
        GraphModel g = graph.mapNode(node.getId(), n -> n.withEntry(entry));
        return new EngineState(doc, g);
    }

    public EngineState withGraph(GraphModel graph) {
        return new EngineState(document, graph);
    }

    public List<Node> leaves() {
        return graph.leaves();
    }
}

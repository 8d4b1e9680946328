package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.Node;

import java.util.List;
import java.util.Objects;

/**
 * An edit to apply through the {@link Synchronizer}. Create with the static factories.
 */
public interface GraphEdit {

    /** Short edit name, used in logs and metric tags. */
    String type();

    /** Folds node positions, names and params back; unknown node ids are skipped with a warning. */
    static GraphEdit setNodes(List<Node> nodes) {
        return new SetNodes(nodes);
    }

    /** Replaces the connection list wholesale; connections win over current params. */
    static GraphEdit setConnections(List<Connection> connections) {
        return new SetConnections(connections);
    }

    /** Replaces a leaf's params; a changed reference value rewires its connection (params win). */
    static GraphEdit updateParams(String nodeId, Object params) {
        return new UpdateParams(nodeId, params, null, null);
    }

    /**
     * @param params   new wire params; null keeps the current ones, a non-map becomes {@code {}}
     * @param interval new interval; null keeps the current one
     * @param name     new entry name; null or blank keeps the current one
     */
    static GraphEdit updateParams(String nodeId, Object params, Long interval, String name) {
        return new UpdateParams(nodeId, params, interval, name);
    }

    /** Removes a leaf's entry, or every entry of a group node's role, then rebuilds. */
    static GraphEdit removeNode(String nodeId) {
        return new RemoveNode(nodeId);
    }

    /** Appends an entry to a role, then rebuilds. */
    static GraphEdit addEntry(Role role, PluginEntry entry) {
        return new AddEntry(role, entry);
    }

    /** Makes {@code document} the canonical document, then rebuilds. */
    static GraphEdit replaceDocument(ConfigDocument document) {
        return new ReplaceDocument(document);
    }

    record SetNodes(List<Node> nodes) implements GraphEdit {
        public SetNodes {
            nodes = nodes != null ? nodes.stream().filter(Objects::nonNull).toList() : List.of();
        }

        @Override
        public String type() {
            return "setNodes";
        }
    }

    record SetConnections(List<Connection> connections) implements GraphEdit {
        public SetConnections {
            connections = connections != null ? connections.stream().filter(Objects::nonNull).toList() : List.of();
        }

        @Override
        public String type() {
            return "setConnections";
        }
    }

    record UpdateParams(String nodeId, Object params, Long interval, String name) implements GraphEdit {
        @Override
        public String type() {
            return "updateParams";
        }
    }

    record RemoveNode(String nodeId) implements GraphEdit {
        @Override
        public String type() {
            return "removeNode";
        }
    }

    record AddEntry(Role role, PluginEntry entry) implements GraphEdit {
        @Override
        public String type() {
            return "addEntry";
        }
    }

    record ReplaceDocument(ConfigDocument document) implements GraphEdit {
        @Override
        public String type() {
            return "replaceDocument";
        }
    }
}

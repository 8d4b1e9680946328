package com.flowgraph.engine.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable snapshot of the graph view: top-level nodes (group nodes own their leaves) and the flat
 * list of connections.
 */
public final class GraphModel {

    public static final GraphModel EMPTY = new GraphModel(List.of(), List.of());

    private final List<Node> nodes;
    private final List<Connection> connections;

    public GraphModel(List<Node> nodes, List<Connection> connections) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.connections = connections != null ? List.copyOf(connections) : List.of();
    }

    /** Top-level nodes in layout order. */
    public List<Node> getNodes() {
        return nodes;
    }

    public List<Connection> getConnections() {
        return connections;
    }

    /** Node with {@code id} at any depth. */
    public Optional<Node> findNode(String id) {
        if (id == null) return Optional.empty();
        for (Node node : nodes) {
            if (node.getId().equals(id)) return Optional.of(node);
            for (Node child : node.getChildren()) {
                if (child.getId().equals(id)) return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** All leaf nodes, top-level leaves and group children, in layout order. */
    public List<Node> leaves() {
        List<Node> out = new ArrayList<>();
        for (Node node : nodes) {
            if (node.isLeaf()) {
                out.add(node);
            }
            for (Node child : node.getChildren()) {
                if (child.isLeaf()) out.add(child);
            }
        }
        return out;
    }

    /** Connection ending at input {@code input} of {@code nodeId}, if any. */
    public Optional<Connection> connectionTo(String nodeId, String input) {
        return connections.stream().filter(c -> c.targets(nodeId, input)).findFirst();
    }

    public GraphModel withConnections(List<Connection> connections) {
        return new GraphModel(nodes, connections);
    }

    /** Returns a graph where every node (at any depth) is replaced by {@code fn.apply(node)}. */
    public GraphModel mapNodes(UnaryOperator<Node> fn) {
        List<Node> mapped = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            Node updated = fn.apply(node);
            if (!updated.getChildren().isEmpty()) {
                List<Node> children = new ArrayList<>(updated.getChildren().size());
                for (Node child : updated.getChildren()) {
                    children.add(fn.apply(child));
                }
                updated = updated.withChildren(children);
            }
            mapped.add(updated);
        }
        return new GraphModel(mapped, connections);
    }

    /** Returns a graph where the node with {@code id} is replaced by {@code fn.apply(node)}. */
    public GraphModel mapNode(String id, UnaryOperator<Node> fn) {
        return mapNodes(n -> n.getId().equals(id) ? fn.apply(n) : n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphModel that = (GraphModel) o;
        return nodes.equals(that.nodes) && connections.equals(that.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, connections);
    }

    @Override
    public String toString() {
        return "GraphModel{nodes=" + nodes + ", connections=" + connections + "}";
    }
}

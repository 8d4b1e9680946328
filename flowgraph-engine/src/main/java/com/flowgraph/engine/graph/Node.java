package com.flowgraph.engine.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowgraph.document.model.ParamValues;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph node. A {@link NodeKind#LEAF leaf} mirrors one document entry: its display name is the entry
 * name and its params are the entry's wire params. A {@link NodeKind#GROUP group} is the synthetic
 * parent of all leaves of one grouped role and carries no params or ports.
 * <p>
 * Ids are positional ({@code source-2}, {@code sources-group}) and are regenerated on every rebuild;
 * {@link #getEntryKey()} is the stable identity of the mirrored entry. Equality ignores the entry key.
 */
public final class Node {

    private final String id;
    private final NodeKind kind;
    private final Role role;
    private final String pluginType;
    private final String displayName;
    private final Position position;
    private final List<Port> inputs;
    private final List<Port> outputs;
    private final Map<String, Object> params;
    private final Long interval;
    private final List<Node> children;
    private final String entryKey;

    @JsonCreator
    public Node(
            @JsonProperty("id") String id,
            @JsonProperty("kind") NodeKind kind,
            @JsonProperty("role") Role role,
            @JsonProperty("pluginType") String pluginType,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("position") Position position,
            @JsonProperty("inputs") List<Port> inputs,
            @JsonProperty("outputs") List<Port> outputs,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("interval") Long interval,
            @JsonProperty("children") List<Node> children,
            @JsonProperty("entryKey") String entryKey) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = kind != null ? kind : NodeKind.LEAF;
        this.role = role;
        this.pluginType = pluginType;
        this.displayName = displayName;
        this.position = position != null ? position : Position.ORIGIN;
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
        this.params = params != null ? ParamValues.copyOf(params) : null;
        this.interval = interval;
        this.children = children != null ? List.copyOf(children) : List.of();
        this.entryKey = entryKey;
    }

    /** Leaf mirroring {@code entry}, without ports (the consistency sweep adds them). */
    public static Node leaf(String id, Role role, PluginEntry entry, Position position) {
        return new Node(id, NodeKind.LEAF, role, entry.getType(), entry.getName(), position,
                null, null, entry.getWireParams(), entry.getInterval(), null, entry.getKey());
    }

    public static Node group(Role role, Position position, List<Node> children) {
        return new Node(role.groupNodeId(), NodeKind.GROUP, role, null, role.getGroupDisplayName(), position,
                null, null, null, null, children, null);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isLeaf() {
        return kind == NodeKind.LEAF;
    }

    public boolean isGroup() {
        return kind == NodeKind.GROUP;
    }

    public Role getRole() {
        return role;
    }

    /** Plugin implementation name of the mirrored entry ({@code type}); may be null. */
    public String getPluginType() {
        return pluginType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Position getPosition() {
        return position;
    }

    public List<Port> getInputs() {
        return inputs;
    }

    public List<Port> getOutputs() {
        return outputs;
    }

    /** Wire params of the mirrored entry; null on group nodes and on incoming nodes that carry no params. */
    public Map<String, Object> getParams() {
        return params;
    }

    public Long getInterval() {
        return interval;
    }

    public List<Node> getChildren() {
        return children;
    }

    public String getEntryKey() {
        return entryKey;
    }

    public Optional<Port> input(String name) {
        return inputs.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Optional<Port> output(String name) {
        return outputs.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Node withPosition(Position position) {
        if (Objects.equals(this.position, position)) return this;
        return new Node(id, kind, role, pluginType, displayName, position, inputs, outputs, params, interval, children, entryKey);
    }

    /** Copy whose display name, type, params and interval mirror {@code entry}. */
    public Node withEntry(PluginEntry entry) {
        return new Node(id, kind, role, entry.getType(), entry.getName(), position, inputs, outputs,
                entry.getWireParams(), entry.getInterval(), children, entry.getKey());
    }

    public Node withPorts(List<Port> inputs, List<Port> outputs) {
        if (this.inputs.equals(inputs) && this.outputs.equals(outputs)) return this;
        return new Node(id, kind, role, pluginType, displayName, position, inputs, outputs, params, interval, children, entryKey);
    }

    public Node withChildren(List<Node> children) {
        if (sameElements(this.children, children)) return this;
        return new Node(id, kind, role, pluginType, displayName, position, inputs, outputs, params, interval, children, entryKey);
    }

    private static boolean sameElements(List<Node> a, List<Node> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id.equals(node.id)
                && kind == node.kind
                && role == node.role
                && Objects.equals(pluginType, node.pluginType)
                && Objects.equals(displayName, node.displayName)
                && position.equals(node.position)
                && inputs.equals(node.inputs)
                && outputs.equals(node.outputs)
                && Objects.equals(params, node.params)
                && Objects.equals(interval, node.interval)
                && children.equals(node.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, role, pluginType, displayName, position, inputs, outputs, params, interval, children);
    }

    @Override
    public String toString() {
        return "Node{" + id + (displayName != null ? " '" + displayName + "'" : "")
                + (children.isEmpty() ? "" : ", children=" + children) + "}";
    }
}

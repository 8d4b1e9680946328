package com.flowgraph.engine.rebuild;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;
import com.flowgraph.engine.graph.Port;
import com.flowgraph.engine.graph.Position;
import com.flowgraph.engine.reference.ReferenceKind;
import com.flowgraph.engine.reference.ReferencePorts;
import com.flowgraph.engine.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the full graph from a document. Pure and deterministic: the same document always yields
 * the same node ids, positions, ports and connections.
 * <p>
 * Roles are laid out in {@link Role#LAYOUT_ORDER}; leaf ids are {@code <prefix>-<index>}; grouped
 * roles with at least one entry get a {@code <role>-group} parent. Every reference value that
 * resolves becomes a connection and marks its input port; dangling values stay in the params, get
 * an unconnected port and are reported in {@link RebuildResult#warnings()}.
 */
public final class Rebuilder {

    private static final Logger log = LoggerFactory.getLogger(Rebuilder.class);

    private Rebuilder() {
    }

    public static RebuildResult rebuild(ConfigDocument document) {
        List<Node> nodes = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        int storageCount = document.getStorage().size();
        double groupY = GraphLayout.firstGroupY();

        for (Role role : Role.LAYOUT_ORDER) {
            List<PluginEntry> entries = document.entries(role);
            if (entries.isEmpty()) continue;
            if (!role.isGrouped()) {
                for (int i = 0; i < entries.size(); i++) {
                    Position pos = role == Role.STORAGE ? GraphLayout.storage(i) : GraphLayout.ai(i, storageCount);
                    Node leaf = Node.leaf(role.nodeId(i), role, entries.get(i), pos);
                    nodes.add(leaf.withPorts(List.of(), ReferencePorts.outputsFor(role)));
                }
                continue;
            }
            List<Node> children = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                Node leaf = Node.leaf(role.nodeId(i), role, entries.get(i), GraphLayout.groupChild(groupY, i));
                children.add(withResolvedInputs(document, leaf, connections));
            }
            nodes.add(Node.group(role, GraphLayout.group(groupY), children));
            groupY = GraphLayout.nextGroupY(groupY, entries.size());
        }

        RebuildResult result = new RebuildResult(new GraphModel(nodes, connections),
                ReferenceResolver.findDanglingReferences(document));
        log.debug("Rebuilt graph for document {}: {} top-level nodes, {} connections, {} dangling references",
                document.getName(), nodes.size(), connections.size(), result.warnings().size());
        return result;
    }

    private static Node withResolvedInputs(ConfigDocument document, Node leaf, List<Connection> connections) {
        List<Port> inputs = new ArrayList<>();
        for (Port port : ReferencePorts.inputsFor(leaf.getRole(), leaf.getParams())) {
            ReferenceKind kind = ReferenceKind.forParamKey(port.getName()).orElseThrow();
            Optional<String> sourceId = ReferenceResolver.resolveNodeId(document, kind, kind.valueIn(leaf.getParams()));
            if (sourceId.isPresent()) {
                connections.add(Connection.of(sourceId.get(), kind.getPortName(), leaf.getId(), kind.getPortName()));
                inputs.add(port.withConnectedTo(sourceId.get()));
            } else {
                inputs.add(port);
            }
        }
        return leaf.withPorts(inputs, List.of());
    }
}

package com.flowgraph.engine.sync;

import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;
import com.flowgraph.engine.graph.Port;
import com.flowgraph.engine.reference.ReferenceKind;
import com.flowgraph.engine.reference.ReferencePorts;
import com.flowgraph.engine.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalizes a state after every mutation, in three ordered passes:
 * <ol>
 *   <li>port regeneration from each leaf's current params;</li>
 *   <li>stale-connection removal: missing endpoints or ports, kind mismatches, unnamed sources and
 *       second connections into the same input port;</li>
 *   <li>parameter re-derivation: each surviving connection writes its source's name into the target
 *       param (node and document). Reference values without a connection are left as typed; those
 *       that resolve get their connection back.</li>
 * </ol>
 * Input ports' {@code connectedTo} is recomputed last. {@code sweep(sweep(s))} equals {@code sweep(s)}.
 */
public final class ConsistencySweep {

    private static final Logger log = LoggerFactory.getLogger(ConsistencySweep.class);

    private ConsistencySweep() {
    }

    /** Swept state plus the number of connections dropped and restored. */
    public record Result(EngineState state, int removedConnections, int restoredConnections) {
    }

    public static EngineState sweep(EngineState state) {
        return run(state).state();
    }

    public static Result run(EngineState state) {
        EngineState s = regeneratePorts(state);

        List<Connection> surviving = new ArrayList<>();
        Set<String> seenTargets = new HashSet<>();
        for (Connection c : s.graph().getConnections()) {
            String reason = staleReason(s.graph(), c);
            if (reason == null && !seenTargets.add(targetKey(c))) {
                reason = "input already connected";
            }
            if (reason != null) {
                log.debug("Sweep dropped connection {}: {}", c, reason);
                continue;
            }
            surviving.add(c);
        }
        int removed = s.graph().getConnections().size() - surviving.size();
        s = s.withGraph(s.graph().withConnections(surviving));

        for (Connection c : surviving) {
            s = deriveParam(s, c);
        }
        int restored = 0;
        List<Connection> withRestored = new ArrayList<>(surviving);
        for (Node leaf : s.leaves()) {
            for (Port input : leaf.getInputs()) {
                if (s.graph().connectionTo(leaf.getId(), input.getName()).isPresent()) continue;
                ReferenceKind kind = ReferenceKind.forParamKey(input.getName()).orElse(null);
                if (kind == null) continue;
                Optional<String> sourceId = ReferenceResolver.resolveNodeId(s.document(), kind, kind.valueIn(leaf.getParams()));
                if (sourceId.isPresent() && s.graph().findNode(sourceId.get()).isPresent()) {
                    withRestored.add(Connection.of(sourceId.get(), kind.getPortName(), leaf.getId(), kind.getPortName()));
                    restored++;
                }
            }
        }
        if (restored > 0) {
            s = s.withGraph(s.graph().withConnections(withRestored));
        }

        s = markConnectedPorts(s);
        if (removed > 0 || restored > 0) {
            log.debug("Sweep removed {} and restored {} connection(s)", removed, restored);
        }
        return new Result(s, removed, restored);
    }

    private static EngineState regeneratePorts(EngineState state) {
        GraphModel g = state.graph().mapNodes(n -> n.isLeaf()
                ? n.withPorts(ReferencePorts.inputsFor(n.getRole(), n.getParams()), ReferencePorts.outputsFor(n.getRole()))
                : n.withPorts(List.of(), List.of()));
        return state.withGraph(g);
    }

    /** Why {@code c} cannot stand in {@code graph}, or null when it can. */
    static String staleReason(GraphModel graph, Connection c) {
        Node from = graph.findNode(c.getFrom().getNodeId()).orElse(null);
        if (from == null || !from.isLeaf()) return "source node missing";
        Node to = graph.findNode(c.getTo().getNodeId()).orElse(null);
        if (to == null || !to.isLeaf()) return "target node missing";
        Port output = from.output(c.getFrom().getOutput()).orElse(null);
        if (output == null) return "source output missing";
        Port input = to.input(c.getTo().getInput()).orElse(null);
        if (input == null) return "target input missing";
        if (!output.getPortKind().equals(input.getPortKind())) return "port kind mismatch";
        if (from.getDisplayName() == null || from.getDisplayName().isBlank()) return "source has no name";
        return null;
    }

    private static EngineState deriveParam(EngineState s, Connection c) {
        Node target = s.leaf(c.getTo().getNodeId()).orElseThrow();
        ReferenceKind kind = ReferenceKind.forParamKey(c.getTo().getInput()).orElseThrow();
        String name = ReferenceResolver.nameForConnection(s.graph(), c).orElseThrow();
        PluginEntry entry = s.entryFor(target).orElse(null);
        if (entry == null || name.equals(entry.getParams().get(kind.getParamKey()))) return s;
        log.debug("Sweep set {}.{} = '{}' from connection", target.getId(), kind.getParamKey(), name);
        return s.withEntry(target, entry.withParam(kind.getParamKey(), name));
    }

    static String targetKey(Connection c) {
        return c.getTo().getNodeId() + "." + c.getTo().getInput();
    }

    private static EngineState markConnectedPorts(EngineState state) {
        Map<String, String> sourceByTarget = new HashMap<>();
        for (Connection c : state.graph().getConnections()) {
            sourceByTarget.put(targetKey(c), c.getFrom().getNodeId());
        }
        GraphModel g = state.graph().mapNodes(n -> {
            if (n.getInputs().isEmpty()) return n;
            List<Port> inputs = new ArrayList<>(n.getInputs().size());
            for (Port p : n.getInputs()) {
                inputs.add(p.withConnectedTo(sourceByTarget.get(n.getId() + "." + p.getName())));
            }
            return n.withPorts(inputs, n.getOutputs());
        });
        return state.withGraph(g);
    }
}

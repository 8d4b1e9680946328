package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;
import com.flowgraph.engine.rebuild.Rebuilder;
import com.flowgraph.engine.reference.ReferenceKind;
import com.flowgraph.engine.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Folds graph edits back into the document and runs the {@link ConsistencySweep}. Pure: takes a state
 * and returns a new one, never mutating its input.
 * <p>
 * Precedence when a connection and a param disagree: {@code setConnections} writes the connection's
 * source name into the param; {@code updateParams} rewires the connection to whatever the param now
 * names. Structural edits (remove, add, replace) rebuild the graph from the document, because
 * positional ids shift.
 */
public final class Synchronizer {

    private static final Logger log = LoggerFactory.getLogger(Synchronizer.class);

    private Synchronizer() {
    }

    /** Keyed, rebuilt and swept state for a freshly loaded document. */
    public static EngineState initialState(ConfigDocument document) {
        Objects.requireNonNull(document, "document");
        ConfigDocument keyed = document.withEntryKeys();
        return ConsistencySweep.sweep(new EngineState(keyed, Rebuilder.rebuild(keyed).graph()));
    }

    public static SyncResult apply(GraphEdit edit, EngineState state) {
        Objects.requireNonNull(edit, "edit");
        Objects.requireNonNull(state, "state");
        List<String> warnings = new ArrayList<>();
        EngineState next;
        if (edit instanceof GraphEdit.UpdateParams u) {
            next = updateParams(state, u, warnings);
        } else if (edit instanceof GraphEdit.SetConnections sc) {
            next = setConnections(state, sc.connections(), warnings);
        } else if (edit instanceof GraphEdit.SetNodes sn) {
            next = setNodes(state, sn.nodes(), warnings);
        } else if (edit instanceof GraphEdit.RemoveNode rn) {
            next = removeNode(state, rn.nodeId());
        } else if (edit instanceof GraphEdit.AddEntry ae) {
            next = addEntry(state, ae.role(), ae.entry(), warnings);
        } else if (edit instanceof GraphEdit.ReplaceDocument rd) {
            next = replaceDocument(state, rd.document());
        } else {
            throw new IllegalArgumentException("Unsupported edit: " + edit.type());
        }

        if (next == null) {
            log.debug("{} found no target; state unchanged", edit.type());
            return new SyncResult(state, SyncOutcome.NOT_FOUND, warnings, 0);
        }
        ConsistencySweep.Result swept = ConsistencySweep.run(next);
        if (swept.state().equals(state)) {
            log.debug("{} produced no change", edit.type());
            return new SyncResult(state, SyncOutcome.UNCHANGED, warnings, 0);
        }
        return new SyncResult(swept.state(), SyncOutcome.APPLIED, warnings, swept.removedConnections());
    }

    // --- updateParams ---------------------------------------------------------------------------

    private static EngineState updateParams(EngineState state, GraphEdit.UpdateParams edit, List<String> warnings) {
        Node node = state.leaf(edit.nodeId()).orElse(null);
        if (node == null) return null;
        PluginEntry current = state.entryFor(node).orElse(null);
        if (current == null) return null;

        Map<String, Object> params = coerceParams(edit.nodeId(), edit.params(), current, warnings);
        if (node.getRole().acceptsReferences()) {
            for (ReferenceKind kind : ReferenceKind.values()) {
                Object v = params.get(kind.getParamKey());
                if (params.containsKey(kind.getParamKey()) && (v == null || (v instanceof String && ((String) v).isBlank()))) {
                    params.remove(kind.getParamKey());
                }
            }
        }
        PluginEntry updated = current.withParams(params);
        if (edit.interval() != null) {
            updated = updated.withInterval(edit.interval());
        }
        if (edit.name() != null && !edit.name().isBlank()) {
            updated = updated.withName(edit.name());
        }
        if (updated.equals(current)) return state;

        EngineState next = state.withEntry(node, updated);
        if (!node.getRole().acceptsReferences()) return next;

        List<Connection> connections = new ArrayList<>(next.graph().getConnections());
        for (ReferenceKind kind : ReferenceKind.values()) {
            String before = kind.valueIn(current.getParams());
            String after = kind.valueIn(updated.getParams());
            if (Objects.equals(before, after)) continue;
            connections.removeIf(c -> c.targets(node.getId(), kind.getPortName()));
            if (after != null) {
                Optional<String> sourceId = ReferenceResolver.resolveNodeId(next.document(), kind, after);
                sourceId.ifPresent(id -> connections.add(
                        Connection.of(id, kind.getPortName(), node.getId(), kind.getPortName())));
                log.debug("{}.{} changed to '{}' ({})", node.getId(), kind.getParamKey(), after,
                        sourceId.map(id -> "connected to " + id).orElse("dangling"));
            } else {
                log.debug("{}.{} cleared; connection removed", node.getId(), kind.getParamKey());
            }
        }
        return next.withGraph(next.graph().withConnections(connections));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> coerceParams(String nodeId, Object raw, PluginEntry current, List<String> warnings) {
        if (raw == null) {
            return new LinkedHashMap<>(current.getWireParams());
        }
        if (!(raw instanceof Map)) {
            warnings.add("Params for " + nodeId + " are not an object (" + raw.getClass().getSimpleName() + "); using {}");
            return new LinkedHashMap<>();
        }
        Map<String, Object> params = new LinkedHashMap<>();
        ((Map<Object, Object>) raw).forEach((k, v) -> {
            if (k != null) params.put(String.valueOf(k), v);
        });
        return params;
    }

    // --- setConnections -------------------------------------------------------------------------

    private static EngineState setConnections(EngineState state, List<Connection> proposed, List<String> warnings) {
        GraphModel graph = state.graph();
        Map<String, Connection> byTarget = new LinkedHashMap<>();
        for (Connection c : proposed) {
            String reason = invalidReason(graph, c);
            if (reason != null) {
                warnings.add("Dropped connection " + c + ": " + reason);
                continue;
            }
            Connection replaced = byTarget.remove(ConsistencySweep.targetKey(c));
            if (replaced != null && !replaced.equals(c)) {
                log.debug("Connection {} replaced by later {}", replaced, c);
            }
            byTarget.put(ConsistencySweep.targetKey(c), c);
        }

        Set<String> previouslyConnected = new LinkedHashSet<>();
        for (Connection c : graph.getConnections()) {
            previouslyConnected.add(ConsistencySweep.targetKey(c));
        }

        EngineState next = state;
        for (Node leaf : graph.leaves()) {
            if (!leaf.getRole().acceptsReferences()) continue;
            PluginEntry entry = next.entryFor(leaf).orElse(null);
            if (entry == null) continue;
            PluginEntry updated = entry;
            for (ReferenceKind kind : ReferenceKind.values()) {
                String key = leaf.getId() + "." + kind.getPortName();
                Connection c = byTarget.get(key);
                if (c != null) {
                    String name = ReferenceResolver.nameForConnection(graph, c).orElseThrow();
                    updated = updated.withParam(kind.getParamKey(), name);
                } else if (previouslyConnected.contains(key)) {
                    updated = updated.withoutParam(kind.getParamKey());
                }
            }
            if (updated != entry) {
                Node current = next.leaf(leaf.getId()).orElseThrow();
                next = next.withEntry(current, updated);
            }
        }
        return next.withGraph(next.graph().withConnections(new ArrayList<>(byTarget.values())));
    }

    /** Why a proposed connection cannot be drawn, or null when it can. */
    private static String invalidReason(GraphModel graph, Connection c) {
        Node from = graph.findNode(c.getFrom().getNodeId()).orElse(null);
        if (from == null) return "unknown source node";
        Node to = graph.findNode(c.getTo().getNodeId()).orElse(null);
        if (to == null) return "unknown target node";
        if (!from.isLeaf() || !to.isLeaf()) return "group nodes cannot be connected";
        ReferenceKind sourceKind = ReferenceKind.forTargetRole(from.getRole()).orElse(null);
        if (sourceKind == null || !sourceKind.getPortName().equals(c.getFrom().getOutput())) {
            return "source has no output '" + c.getFrom().getOutput() + "'";
        }
        if (!to.getRole().acceptsReferences()) return "target does not accept references";
        ReferenceKind targetKind = ReferenceKind.forParamKey(c.getTo().getInput()).orElse(null);
        if (targetKind == null) return "target has no input '" + c.getTo().getInput() + "'";
        if (targetKind != sourceKind) return "port kind mismatch";
        if (from.getDisplayName() == null || from.getDisplayName().isBlank()) return "source has no name";
        return null;
    }

    // --- setNodes -------------------------------------------------------------------------------

    private static EngineState setNodes(EngineState state, List<Node> incoming, List<String> warnings) {
        List<Node> flat = new ArrayList<>();
        for (Node n : incoming) {
            flat.add(n);
            flat.addAll(n.getChildren());
        }
        EngineState next = state;
        for (Node n : flat) {
            Node existing = next.graph().findNode(n.getId()).orElse(null);
            if (existing == null) {
                warnings.add("Unknown node " + n.getId() + " ignored");
                continue;
            }
            next = next.withGraph(next.graph().mapNode(n.getId(), e -> e.withPosition(n.getPosition())));
            if (!existing.isLeaf()) continue;

            boolean renamed = n.getDisplayName() != null && !n.getDisplayName().equals(existing.getDisplayName());
            boolean paramsChanged = n.getParams() != null && !n.getParams().equals(existing.getParams());
            boolean intervalChanged = n.getInterval() != null && !n.getInterval().equals(existing.getInterval());
            if (renamed || paramsChanged || intervalChanged) {
                GraphEdit.UpdateParams update = new GraphEdit.UpdateParams(n.getId(),
                        paramsChanged ? n.getParams() : null,
                        intervalChanged ? n.getInterval() : null,
                        renamed ? n.getDisplayName() : null);
                EngineState updated = updateParams(next, update, warnings);
                if (updated != null) next = updated;
            }
        }
        return next;
    }

    // --- structural edits -----------------------------------------------------------------------

    private static EngineState removeNode(EngineState state, String nodeId) {
        Node node = state.graph().findNode(nodeId).orElse(null);
        if (node == null || node.getRole() == null) return null;
        Role role = node.getRole();
        ConfigDocument doc = state.document();
        List<String> removedNames = new ArrayList<>();
        if (node.isGroup()) {
            for (PluginEntry e : doc.entries(role)) {
                removedNames.add(e.getName());
            }
            doc = doc.withEntries(role, List.of());
        } else {
            int index = state.entryIndex(node);
            if (index < 0) return null;
            removedNames.add(doc.entries(role).get(index).getName());
            doc = doc.withoutEntry(role, index);
        }

        Optional<ReferenceKind> kind = ReferenceKind.forTargetRole(role);
        if (kind.isPresent()) {
            for (String name : new LinkedHashSet<>(removedNames)) {
                if (name == null) continue;
                if (ReferenceResolver.resolveByName(doc, role, name).isPresent()) {
                    log.debug("Not clearing {} '{}': another {} entry has that name", kind.get().getParamKey(), name, role.getJsonKey());
                    continue;
                }
                doc = cascadeClear(doc, kind.get(), name);
            }
        }
        log.debug("Removed {} ({} entr{})", nodeId, removedNames.size(), removedNames.size() == 1 ? "y" : "ies");
        return new EngineState(doc, Rebuilder.rebuild(doc).graph());
    }

    /** Clears every {@code kind} value equal to {@code name}, nested children included. */
    static ConfigDocument cascadeClear(ConfigDocument doc, ReferenceKind kind, String name) {
        ConfigDocument result = doc;
        for (Role role : Role.LAYOUT_ORDER) {
            if (!role.acceptsReferences()) continue;
            List<PluginEntry> entries = result.entries(role);
            List<PluginEntry> cleared = new ArrayList<>(entries.size());
            boolean changed = false;
            for (PluginEntry entry : entries) {
                PluginEntry c = clearReference(entry, kind, name);
                changed |= c != entry;
                cleared.add(c);
            }
            if (changed) {
                result = result.withEntries(role, cleared);
            }
        }
        return result;
    }

    private static PluginEntry clearReference(PluginEntry entry, ReferenceKind kind, String name) {
        PluginEntry result = entry;
        if (name.equals(entry.getParams().get(kind.getParamKey()))) {
            result = result.withoutParam(kind.getParamKey());
            log.debug("Cleared {} '{}' on entry {}", kind.getParamKey(), name, entry.getName());
        }
        if (!entry.getChildren().isEmpty()) {
            List<PluginEntry> children = new ArrayList<>(entry.getChildren().size());
            boolean changed = false;
            for (PluginEntry child : entry.getChildren()) {
                PluginEntry c = clearReference(child, kind, name);
                changed |= c != child;
                children.add(c);
            }
            if (changed) {
                result = result.withChildren(children);
            }
        }
        return result;
    }

    private static EngineState addEntry(EngineState state, Role role, PluginEntry entry, List<String> warnings) {
        if (role == null || entry == null) {
            warnings.add("addEntry needs a role and an entry; nothing added");
            return state;
        }
        if (entry.getName() == null || entry.getName().isBlank()) {
            warnings.add("New " + role.getNodePrefix() + " entry has no name");
        } else if (ReferenceResolver.resolveByName(state.document(), role, entry.getName()).isPresent()) {
            warnings.add("Name '" + entry.getName() + "' is already used in " + role.getJsonKey()
                    + "; references bind to the first entry");
        }
        PluginEntry keyed = state.document().usesKey(entry.getKey())
                ? entry.withKey(UUID.randomUUID().toString())
                : entry.withEnsuredKey();
        ConfigDocument doc = state.document().withAddedEntry(role, keyed);
        return new EngineState(doc, Rebuilder.rebuild(doc).graph());
    }

    private static EngineState replaceDocument(EngineState state, ConfigDocument document) {
        Objects.requireNonNull(document, "document");
        if (document.equals(state.document())) return state;
        ConfigDocument keyed = EntryKeys.carryOver(state.document(), document);
        return new EngineState(keyed, Rebuilder.rebuild(keyed).graph());
    }
}

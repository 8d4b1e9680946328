package com.flowgraph.engine.reference;

import com.flowgraph.document.model.Role;
import com.flowgraph.engine.graph.Port;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Which ports a leaf has. A leaf of a grouped role has one input port per reference value present
 * in its params ({@code provider} before {@code storage}); {@code ai} and {@code storage} leaves have
 * a single output port of their kind. Group nodes have none.
 */
public final class ReferencePorts {

    private ReferencePorts() {
    }

    /** Unconnected input ports for a leaf of {@code role} with {@code params}. */
    public static List<Port> inputsFor(Role role, Map<String, ?> params) {
        if (role == null || !role.acceptsReferences()) return List.of();
        List<Port> inputs = new ArrayList<>(2);
        for (ReferenceKind kind : ReferenceKind.values()) {
            if (kind.valueIn(params) != null) {
                inputs.add(Port.of(kind.getPortName(), kind.getPortKind()));
            }
        }
        return inputs;
    }

    public static List<Port> outputsFor(Role role) {
        return ReferenceKind.forTargetRole(role)
                .map(kind -> List.of(Port.of(kind.getPortName(), kind.getPortKind())))
                .orElse(List.of());
    }
}

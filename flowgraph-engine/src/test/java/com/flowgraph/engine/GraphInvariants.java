package com.flowgraph.engine;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.Node;
import com.flowgraph.engine.graph.Port;
import com.flowgraph.engine.reference.ReferenceKind;
import com.flowgraph.engine.sync.ConsistencySweep;
import com.flowgraph.engine.sync.DocumentProjection;
import com.flowgraph.engine.sync.EngineState;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Assertions that must hold for every converged state: both views agree, every connection is
 * mirrored by its target param and port, and sweeping again changes nothing.
 */
public final class GraphInvariants {

    private GraphInvariants() {
    }

    public static void assertConverged(EngineState state) {
        ConfigDocument doc = state.document();
        assertEquals(doc, DocumentProjection.toDocument(state.graph(), doc.getName(), doc.getSettings()),
                "graph and document disagree");

        for (Connection c : state.graph().getConnections()) {
            Node from = state.graph().findNode(c.getFrom().getNodeId()).orElse(null);
            Node to = state.graph().findNode(c.getTo().getNodeId()).orElse(null);
            assertNotNull(from, "missing source of " + c);
            assertNotNull(to, "missing target of " + c);
            ReferenceKind kind = ReferenceKind.forParamKey(c.getTo().getInput()).orElseThrow();
            assertEquals(from.getDisplayName(), to.getParams().get(kind.getParamKey()), "param not derived from " + c);
            Port input = to.input(c.getTo().getInput()).orElse(null);
            assertNotNull(input, "missing input port for " + c);
            assertEquals(from.getId(), input.getConnectedTo());
        }
        for (Node leaf : state.leaves()) {
            for (Port input : leaf.getInputs()) {
                if (input.isConnected()) {
                    assertTrue(state.graph().connectionTo(leaf.getId(), input.getName()).isPresent(),
                            "port marked connected without a connection: " + leaf.getId() + "." + input.getName());
                }
            }
        }
        assertEquals(state, ConsistencySweep.sweep(state), "sweep is not at a fixed point");
    }
}

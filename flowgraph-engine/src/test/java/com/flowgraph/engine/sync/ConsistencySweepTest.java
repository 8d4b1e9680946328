package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.engine.GraphInvariants;
import com.flowgraph.engine.TestDocuments;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.rebuild.Rebuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencySweepTest {

    private static EngineState rebuilt(String json) {
        ConfigDocument doc = TestDocuments.parse(json).withEntryKeys();
        return new EngineState(doc, Rebuilder.rebuild(doc).graph());
    }

    @Test
    void sweep_ofRebuiltStateIsFixedPoint() {
        EngineState state = ConsistencySweep.sweep(rebuilt(TestDocuments.PIPELINE));

        GraphInvariants.assertConverged(state);
    }

    @Test
    void sweep_dropsStaleConnections() {
        EngineState state = rebuilt(TestDocuments.PIPELINE);
        List<Connection> junk = new ArrayList<>(state.graph().getConnections());
        junk.add(Connection.of("ai-7", "provider", "source-0", "provider"));        // missing source
        junk.add(Connection.of("ai-0", "provider", "source-9", "provider"));        // missing target
        junk.add(Connection.of("storage-0", "storage", "source-0", "provider"));    // kind mismatch
        junk.add(Connection.of("ai-1", "provider", "source-1", "provider"));        // no such input port
        junk.add(Connection.of("ai-1", "provider", "source-0", "provider"));        // second into same port
        EngineState dirty = state.withGraph(state.graph().withConnections(junk));

        ConsistencySweep.Result result = ConsistencySweep.run(dirty);

        assertEquals(5, result.removedConnections());
        assertEquals(Rebuilder.rebuild(state.document()).graph().getConnections(),
                result.state().graph().getConnections());
        assertEquals("gpt", result.state().document().getSources().get(0).getParams().get("provider"));
        GraphInvariants.assertConverged(result.state());
    }

    @Test
    void sweep_connectionOverwritesTargetParam() {
        EngineState state = rebuilt(TestDocuments.PIPELINE);
        List<Connection> rewired = new ArrayList<>();
        for (Connection c : state.graph().getConnections()) {
            rewired.add(c.targets("source-0", "provider") ? Connection.of("ai-1", "provider", "source-0", "provider") : c);
        }

        EngineState swept = ConsistencySweep.sweep(state.withGraph(state.graph().withConnections(rewired)));

        assertEquals("claude", swept.document().getSources().get(0).getParams().get("provider"));
        assertEquals("claude", swept.graph().findNode("source-0").orElseThrow().getParams().get("provider"));
        GraphInvariants.assertConverged(swept);
    }

    @Test
    void sweep_leavesUnconnectedReferencesAsTyped() {
        EngineState state = rebuilt("""
                { "sources": [ { "name": "rss", "params": { "provider": "later" } } ],
                  "ai": [ { "name": "gpt", "params": {} } ] }
                """);

        EngineState swept = ConsistencySweep.sweep(state);

        assertEquals("later", swept.document().getSources().get(0).getParams().get("provider"));
        assertTrue(swept.graph().getConnections().isEmpty());
        assertFalse(swept.graph().findNode("source-0").orElseThrow().input("provider").orElseThrow().isConnected());
    }

    @Test
    void sweep_restoresConnectionForResolvableReference() {
        EngineState state = rebuilt(TestDocuments.RSS_AND_GPT);
        EngineState stripped = state.withGraph(state.graph().withConnections(List.of()));

        ConsistencySweep.Result result = ConsistencySweep.run(stripped);

        assertEquals(1, result.restoredConnections());
        assertEquals(List.of(Connection.of("ai-0", "provider", "source-0", "provider")),
                result.state().graph().getConnections());
    }

    @Test
    void sweep_isIdempotent() {
        EngineState state = rebuilt(TestDocuments.PIPELINE);
        List<Connection> junk = new ArrayList<>(state.graph().getConnections());
        junk.add(Connection.of("ai-1", "provider", "generator-0", "provider"));
        junk.add(Connection.of("source-0", "provider", "ai-0", "provider"));

        EngineState once = ConsistencySweep.sweep(state.withGraph(state.graph().withConnections(junk)));
        EngineState twice = ConsistencySweep.sweep(once);

        assertEquals(once, twice);
    }
}

package com.flowgraph.engine;

import com.flowgraph.engine.sync.SyncOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer counters for one engine. Tags are low-cardinality (edit type, outcome, result); document
 * names and node ids are never tags.
 */
final class EngineMetrics {

    static final String EDITS = "flowgraph.engine.edits";
    static final String TEXT_EDITS = "flowgraph.engine.text.edits";
    static final String STALE_CONNECTIONS = "flowgraph.engine.sweep.stale.connections";
    static final String SAVES = "flowgraph.engine.saves";
    static final String LOADS = "flowgraph.engine.loads";

    private final MeterRegistry registry;

    EngineMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    MeterRegistry registry() {
        return registry;
    }

    void edit(String type, SyncOutcome outcome) {
        registry.counter(EDITS,
                "type", Objects.requireNonNullElse(type, "unknown"),
                "outcome", outcome.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    void textEdit(TextEditResult result) {
        registry.counter(TEXT_EDITS, "result", result.name().toLowerCase(Locale.ROOT)).increment();
    }

    void staleConnectionsRemoved(int count) {
        if (count > 0) {
            registry.counter(STALE_CONNECTIONS).increment(count);
        }
    }

    void save(boolean success) {
        registry.counter(SAVES, "success", String.valueOf(success)).increment();
    }

    void load(boolean found) {
        registry.counter(LOADS, "found", String.valueOf(found)).increment();
    }
}

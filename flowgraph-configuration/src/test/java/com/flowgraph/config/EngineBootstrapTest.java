package com.flowgraph.config;

import com.flowgraph.document.model.Role;
import com.flowgraph.engine.GraphConfigEngine;
import com.flowgraph.engine.event.EngineEventKind;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EngineBootstrapTest {

    private static final String DEFAULT_JSON = "{\n"
            + "  \"name\": \"default\",\n"
            + "  \"sources\": [ { \"type\": \"RSSSource\", \"name\": \"hn\", \"params\": { \"url\": \"https://news.ycombinator.com/rss\" } } ],\n"
            + "  \"generators\": [ { \"type\": \"DailySummaryGenerator\", \"name\": \"digest\", \"params\": { \"provider\": \"gpt\", \"storage\": \"db\" } } ],\n"
            + "  \"ai\": [ { \"type\": \"OpenAIProvider\", \"name\": \"gpt\", \"params\": { \"model\": \"gpt-4o\" } } ],\n"
            + "  \"storage\": [ { \"type\": \"SQLiteStorage\", \"name\": \"db\", \"params\": {} } ]\n"
            + "}\n";

    @TempDir
    Path dir;

    private FlowGraphConfig.Builder fileOnly() {
        return FlowGraphConfig.builder().configDir(dir.toString());
    }

    @Test
    void loadsDefaultDocumentFromConfigDir() throws Exception {
        Files.writeString(dir.resolve("default.json"), DEFAULT_JSON);

        try (EngineRuntime runtime = EngineBootstrap.initialize(fileOnly().build())) {
            GraphConfigEngine engine = runtime.getEngine();

            assertEquals("default", engine.getDocument().getName());
            assertEquals(1, engine.getDocument().entries(Role.GENERATORS).size());
            assertEquals(2, engine.getConnections().size());
            assertFalse(engine.hasPendingChanges());
            assertTrue(runtime.getCache().isEmpty());
            assertInstanceOf(SimpleMeterRegistry.class, engine.getMeterRegistry());
        }
    }

    @Test
    void namedDocumentFallsBackToDefaultFile() throws Exception {
        Files.writeString(dir.resolve("default.json"), DEFAULT_JSON);

        try (EngineRuntime runtime = EngineBootstrap.initialize(fileOnly().defaultDocument("weekly").build())) {
            assertEquals("default", runtime.getEngine().getDocument().getName());
        }
    }

    @Test
    void startsEmptyWhenNothingIsFound() {
        try (EngineRuntime runtime = EngineBootstrap.initialize(fileOnly().defaultDocument("fresh").build())) {
            GraphConfigEngine engine = runtime.getEngine();

            assertEquals("fresh", engine.getDocument().getName());
            assertTrue(engine.getDocument().hasNoEntries());
            assertTrue(engine.getNodes().isEmpty());
        }
    }

    @Test
    void editsSaveBackToConfigDir() throws Exception {
        Files.writeString(dir.resolve("default.json"), DEFAULT_JSON);

        try (EngineRuntime runtime = EngineBootstrap.initialize(fileOnly().build())) {
            GraphConfigEngine engine = runtime.getEngine();
            AtomicInteger documentEvents = new AtomicInteger();
            engine.subscribe(EngineEventKind.DOCUMENT_UPDATED, e -> documentEvents.incrementAndGet());

            String generatorId = engine.getGraph().leaves().stream()
                    .filter(n -> "digest".equals(n.getDisplayName()))
                    .findFirst().orElseThrow().getId();
            assertTrue(engine.updateParams(generatorId, Map.of("provider", "gpt", "storage", "db", "summaryType", "daily")));
            assertTrue(engine.hasPendingChanges());
            assertTrue(engine.save());

            assertEquals(1, documentEvents.get());
            assertFalse(engine.hasPendingChanges());
            assertTrue(Files.readString(dir.resolve("default.json")).contains("\"summaryType\""));
        }
    }

    @Test
    void catalogResourceFeedsAddPlugin() {
        FlowGraphConfig config = fileOnly().catalogResource("test-catalog.json").build();

        try (EngineRuntime runtime = EngineBootstrap.initialize(config)) {
            GraphConfigEngine engine = runtime.getEngine();
            engine.addPlugin(Role.GENERATORS, "DailySummaryGenerator", "digest", Map.of());

            assertEquals(1, engine.getDocument().entries(Role.GENERATORS).size());
            assertEquals(1, engine.getDocument().entries(Role.AI).size());
            assertEquals(1, engine.getDocument().entries(Role.STORAGE).size());
        }
    }

    @Test
    void disabledMetricsUseNoOpRegistry() {
        try (EngineRuntime runtime = EngineBootstrap.initialize(fileOnly().metricsEnabled(false).build())) {
            assertInstanceOf(CompositeMeterRegistry.class, runtime.getEngine().getMeterRegistry());
        }
    }
}

package com.flowgraph.engine;

import com.flowgraph.catalog.InMemoryPluginCatalog;
import com.flowgraph.catalog.ParameterDef;
import com.flowgraph.catalog.PluginDescriptor;
import com.flowgraph.document.DocumentJson;
import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.document.store.DocumentStore;
import com.flowgraph.document.store.DocumentStoreException;
import com.flowgraph.document.store.FileDocumentStore;
import com.flowgraph.engine.event.EngineEvent;
import com.flowgraph.engine.event.EngineEventKind;
import com.flowgraph.engine.event.EntryUpdate;
import com.flowgraph.engine.event.Subscription;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.sync.SyncOutcome;
import com.flowgraph.engine.sync.SyncResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphConfigEngineTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private GraphConfigEngine engine;
    private final List<EngineEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = new GraphConfigEngine(new FileDocumentStore(tempDir), catalog(), registry);
        for (EngineEventKind kind : EngineEventKind.values()) {
            engine.subscribe(kind, events::add);
        }
    }

    private static InMemoryPluginCatalog catalog() {
        return InMemoryPluginCatalog.of(List.of(
                PluginDescriptor.of("DailySummaryGenerator", Role.GENERATORS,
                        List.of(ParameterDef.of("title", "string", true)),
                        List.of(ParameterDef.of("provider", "AIProvider", true), ParameterDef.of("storage", "StoragePlugin", true))),
                PluginDescriptor.of("RSSSource", Role.SOURCES,
                        List.of(ParameterDef.of("url", "string", true)), List.of())));
    }

    private List<EngineEventKind> kinds() {
        List<EngineEventKind> out = new ArrayList<>();
        events.forEach(e -> out.add(e.kind()));
        return out;
    }

    @Test
    void loadDocument_emitsFullSnapshot() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));

        assertEquals(List.of(EngineEventKind.DOCUMENT_UPDATED, EngineEventKind.NODES_UPDATED,
                EngineEventKind.CONNECTIONS_UPDATED), kinds());
        assertEquals(1, engine.getConnections().size());
        assertFalse(engine.hasPendingChanges());
        assertTrue(engine.getDocumentText().contains("\"rss\""));
    }

    @Test
    void edit_notifiesOnlyChangedParts() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.PIPELINE));
        events.clear();

        assertTrue(engine.updateParams("source-1", Map.of("url", "https://lobste.rs/top/rss")));

        assertEquals(List.of(EngineEventKind.DOCUMENT_UPDATED, EngineEventKind.NODES_UPDATED,
                EngineEventKind.ENTRY_UPDATED), kinds());
        EntryUpdate update = events.get(2).payload(EntryUpdate.class);
        assertEquals("source-1", update.nodeId());
        assertEquals("https://lobste.rs/top/rss", update.entry().getParams().get("url"));
        assertTrue(engine.hasPendingChanges());
    }

    @Test
    void unchangedEdit_emitsNothing() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        events.clear();

        assertTrue(engine.updateParams("source-0", Map.of("provider", "gpt")));

        assertTrue(events.isEmpty());
        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void unknownNode_returnsFalse() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        events.clear();

        assertFalse(engine.removeNode("generator-3"));
        assertFalse(engine.updateParams("ai-4", Map.of()));
        assertTrue(events.isEmpty());
    }

    @Test
    void listenerMutation_isRejected() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        engine.subscribe(EngineEventKind.DOCUMENT_UPDATED, e -> {
            try {
                engine.removeNode("ai-0");
            } catch (IllegalStateException ex) {
                failure.set(ex);
            }
        });

        engine.updateParams("source-0", Map.of("provider", "gpt", "url", "u"));

        assertInstanceOf(IllegalStateException.class, failure.get());
        assertEquals(1, engine.getDocument().getAi().size());
    }

    @Test
    void throwingListener_doesNotStopOthers() {
        engine.subscribe(EngineEventKind.DOCUMENT_UPDATED, e -> {
            throw new IllegalArgumentException("boom");
        });
        List<EngineEvent> after = new ArrayList<>();
        engine.subscribe(EngineEventKind.DOCUMENT_UPDATED, after::add);

        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));

        assertEquals(1, after.size());
        assertEquals(3, events.size());
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<EngineEvent> received = new ArrayList<>();
        Subscription subscription = engine.subscribe(EngineEventKind.NODES_UPDATED, received::add);
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        subscription.unsubscribe();
        subscription.unsubscribe();

        engine.removeNode("ai-0");

        assertEquals(1, received.size());
    }

    @Test
    void save_clearsPendingChanges() throws Exception {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        engine.removeNode("ai-0");
        assertTrue(engine.hasPendingChanges());

        assertTrue(engine.save());

        assertFalse(engine.hasPendingChanges());
        ConfigDocument saved = DocumentJson.fromJson(Files.readString(tempDir.resolve("default.json")));
        assertEquals(engine.getDocument(), saved);
        assertEquals(1.0, registry.counter(EngineMetrics.SAVES, "success", "true").count());
    }

    @Test
    void failedSave_keepsPendingChanges() {
        DocumentStore failing = new DocumentStore() {
            @Override
            public Optional<ConfigDocument> load(String name) {
                return Optional.empty();
            }

            @Override
            public void save(String name, ConfigDocument document) {
                throw new DocumentStoreException("disk full");
            }
        };
        GraphConfigEngine local = new GraphConfigEngine(failing);
        local.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        local.removeNode("ai-0");

        assertFalse(local.save());
        assertTrue(local.hasPendingChanges());
        assertFalse(local.loadDocument("missing"));
    }

    @Test
    void saveAsync_completesAndClearsPending() throws Exception {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        engine.removeNode("ai-0");

        assertTrue(engine.saveAsync(Runnable::run).get());

        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void saveAsync_completingAfterLoadKeepsNewEditsPending() throws Exception {
        engine.loadDocument(TestDocuments.parse(TestDocuments.PIPELINE));
        engine.updateParams("source-1", Map.of("url", "https://lobste.rs/a.rss"));
        engine.updateParams("source-1", Map.of("url", "https://lobste.rs/b.rss"));
        engine.updateParams("source-1", Map.of("url", "https://lobste.rs/c.rss"));
        List<Runnable> queued = new ArrayList<>();
        CompletableFuture<Boolean> save = engine.saveAsync(queued::add);

        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT).withName("other"));
        engine.updateParams("source-0", Map.of("provider", "gpt", "url", "https://a.example/rss"));
        engine.updateParams("source-0", Map.of("provider", "gpt", "url", "https://b.example/rss"));
        queued.forEach(Runnable::run);
        engine.updateParams("source-0", Map.of("provider", "gpt", "url", "https://c.example/rss"));

        assertTrue(save.get());
        assertTrue(engine.hasPendingChanges());
        assertTrue(engine.save());
        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void loadDocument_clearsPendingChanges() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        engine.removeNode("ai-0");
        assertTrue(engine.hasPendingChanges());

        engine.loadDocument(TestDocuments.parse(TestDocuments.PIPELINE));

        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void loadDocument_byNameFromStore() {
        new FileDocumentStore(tempDir).save("news", TestDocuments.parse(TestDocuments.PIPELINE).withName("news"));

        assertTrue(engine.loadDocument("news"));

        assertEquals("news", engine.getDocument().getName());
        assertEquals(5, engine.getConnections().size());
        assertFalse(engine.loadDocument("absent"));
    }

    @Test
    void documentText_parseErrorIsHeldPending() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        ConfigDocument before = engine.getDocument();
        events.clear();

        TextEditResult result = engine.applyDocumentText("{\n  \"sources\": [ {\"name\": }\n}");

        assertEquals(TextEditResult.PARSE_ERROR, result);
        assertEquals(before, engine.getDocument());
        assertTrue(events.isEmpty());
        assertTrue(engine.getPendingParseError().isPresent());
        assertEquals(2, engine.getPendingParseError().get().getLine());
        assertTrue(engine.getDocumentText().contains("{\"name\": }"));
    }

    @Test
    void documentText_formattingOnlyIsUnchanged() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        events.clear();

        TextEditResult result = engine.applyDocumentText(DocumentJson.toJson(engine.getDocument()));

        assertEquals(TextEditResult.UNCHANGED, result);
        assertTrue(events.isEmpty());
        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void documentText_semanticChangeRebuilds() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        engine.applyDocumentText("not json");
        events.clear();

        String text = """
                { "sources": [ { "name": "rss", "params": { "provider": "claude" } } ],
                  "ai": [ { "name": "gpt", "params": {} }, { "name": "claude", "params": {} } ] }
                """;
        TextEditResult result = engine.applyDocumentText(text);

        assertEquals(TextEditResult.APPLIED, result);
        assertTrue(engine.getPendingParseError().isEmpty());
        assertEquals(text, engine.getDocumentText());
        assertEquals(List.of(Connection.of("ai-1", "provider", "source-0", "provider")), engine.getConnections());
        assertTrue(kinds().contains(EngineEventKind.DOCUMENT_UPDATED));
        assertTrue(kinds().contains(EngineEventKind.CONNECTIONS_UPDATED));
        assertTrue(engine.hasPendingChanges());
    }

    @Test
    void selection_clearedWhenNodeDisappears() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        assertFalse(engine.selectNode("storage-0"));
        assertTrue(engine.selectNode("ai-0"));
        events.clear();

        engine.removeNode("ai-0");

        assertTrue(engine.getSelectedNodeId().isEmpty());
        EngineEvent last = events.get(events.size() - 1);
        assertEquals(EngineEventKind.NODE_SELECTED, last.kind());
        assertNull(last.payload());
    }

    @Test
    void addPlugin_createsMissingDependencies() {
        engine.loadDocument(ConfigDocument.empty("fresh"));

        SyncResult result = engine.addPlugin(Role.GENERATORS, "DailySummaryGenerator", "digest", Map.of("title", "Daily"));

        assertEquals(SyncOutcome.APPLIED, result.outcome());
        ConfigDocument doc = engine.getDocument();
        assertEquals("OpenAIProvider", doc.getAi().get(0).getName());
        assertEquals("SQLiteStorage", doc.getStorage().get(0).getName());
        PluginEntry digest = doc.getGenerators().get(0);
        assertEquals("DailySummaryGenerator", digest.getType());
        assertEquals("OpenAIProvider", digest.getParams().get("provider"));
        assertEquals("SQLiteStorage", digest.getParams().get("storage"));
        assertEquals(2, engine.getConnections().size());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void addPlugin_reusesExistingProviderAndReportsShape() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.PIPELINE));

        SyncResult result = engine.addPlugin(Role.GENERATORS, "DailySummaryGenerator", "weekly", Map.of("title", 7));

        ConfigDocument doc = engine.getDocument();
        assertEquals(2, doc.getAi().size());
        assertEquals(1, doc.getStorage().size());
        assertEquals("gpt", doc.getGenerators().get(1).getParams().get("provider"));
        assertEquals("db", doc.getGenerators().get(1).getParams().get("storage"));
        assertEquals(1, result.warnings().size());
        assertFalse(engine.validateEntry("generator-1").isEmpty());
        assertTrue(engine.validateEntry("source-0").isEmpty());
    }

    @Test
    void addPlugin_storagePluginAddsNoProvider() {
        engine.loadDocument(ConfigDocument.empty("fresh"));
        PluginDescriptor vectorStore = PluginDescriptor.of("VectorStorage", Role.STORAGE, List.of(),
                List.of(ParameterDef.of("provider", "AIProvider", true)));

        SyncResult result = engine.addPlugin(vectorStore, "vectors", Map.of());

        assertEquals(SyncOutcome.APPLIED, result.outcome());
        assertTrue(engine.getDocument().getAi().isEmpty());
        assertEquals(Map.of(), engine.getDocument().getStorage().get(0).getParams());
        assertTrue(engine.getConnections().isEmpty());
    }

    @Test
    void addPlugin_unknownPluginIsNotFound() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));

        SyncResult result = engine.addPlugin(Role.SOURCES, "NoSuchSource", "x", Map.of());

        assertEquals(SyncOutcome.NOT_FOUND, result.outcome());
        assertEquals(1, engine.getLastWarnings().size());
    }

    @Test
    void referenceWarnings_reportDanglingValues() {
        engine.loadDocument(DocumentJson.fromJson("""
                { "sources": [ { "name": "rss", "params": { "provider": "ghost" } } ] }
                """));

        assertEquals(1, engine.getReferenceWarnings().size());
        assertEquals("ghost", engine.getReferenceWarnings().get(0).getValue());
    }

    @Test
    void forceSync_reemitsSnapshot() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));
        events.clear();

        engine.forceSync();

        assertEquals(3, events.size());
        assertFalse(engine.hasPendingChanges());
    }

    @Test
    void metrics_countEditsByTypeAndOutcome() {
        engine.loadDocument(TestDocuments.parse(TestDocuments.RSS_AND_GPT));

        engine.updateParams("source-0", Map.of("provider", "other"));
        engine.updateParams("source-0", Map.of("provider", "other"));
        engine.updateParams("nope", Map.of());

        assertEquals(1.0, registry.counter(EngineMetrics.EDITS, "type", "updateParams", "outcome", "applied").count());
        assertEquals(1.0, registry.counter(EngineMetrics.EDITS, "type", "updateParams", "outcome", "unchanged").count());
        assertEquals(1.0, registry.counter(EngineMetrics.EDITS, "type", "updateParams", "outcome", "not_found").count());
        assertNotNull(engine.getMeterRegistry());
    }
}

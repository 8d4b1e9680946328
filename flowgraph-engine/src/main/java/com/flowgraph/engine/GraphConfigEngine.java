package com.flowgraph.engine;

import com.flowgraph.catalog.DependencyPlan;
import com.flowgraph.catalog.DependencyResolver;
import com.flowgraph.catalog.InMemoryPluginCatalog;
import com.flowgraph.catalog.ParameterShapeValidator;
import com.flowgraph.catalog.PluginCatalog;
import com.flowgraph.catalog.PluginDescriptor;
import com.flowgraph.catalog.ShapeWarning;
import com.flowgraph.document.DocumentJson;
import com.flowgraph.document.DocumentParseResult;
import com.flowgraph.document.ParseError;
import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;
import com.flowgraph.document.store.DocumentStore;
import com.flowgraph.document.store.DocumentStoreException;
import com.flowgraph.engine.event.EngineEvent;
import com.flowgraph.engine.event.EngineEventKind;
import com.flowgraph.engine.event.EngineListener;
import com.flowgraph.engine.event.EntryUpdate;
import com.flowgraph.engine.event.Subscription;
import com.flowgraph.engine.graph.Connection;
import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.graph.Node;
import com.flowgraph.engine.reference.ReferenceResolver;
import com.flowgraph.engine.reference.ReferenceWarning;
import com.flowgraph.engine.sync.ConsistencySweep;
import com.flowgraph.engine.sync.EngineState;
import com.flowgraph.engine.sync.GraphEdit;
import com.flowgraph.engine.sync.SyncOutcome;
import com.flowgraph.engine.sync.SyncResult;
import com.flowgraph.engine.sync.Synchronizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one document editing session: the converged document/graph state, the document text view,
 * selection, subscribers and the pending-changes bookkeeping.
 * <p>
 * Every mutation runs Synchronizer, then sweep, then notify in the same call, so listeners only ever
 * see converged state. Listeners are called synchronously and must not mutate the engine; doing so
 * throws {@link IllegalStateException}. A listener that throws is logged and the remaining listeners
 * still run.
 * <p>
 * Not thread-safe: one owner thread drives all mutations. Only {@link #saveAsync(Executor)} completes
 * on another thread, and it touches nothing but the saved-revision marker.
 */
public final class GraphConfigEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphConfigEngine.class);

    private final DocumentStore store;
    private final PluginCatalog catalog;
    private final DependencyResolver dependencyResolver;
    private final EngineMetrics metrics;
    private final Map<EngineEventKind, List<EngineListener>> listeners = new EnumMap<>(EngineEventKind.class);

    private EngineState state;
    private String documentText;
    private String pendingText;
    private ParseError pendingParseError;
    private String selectedNodeId;
    private List<String> lastWarnings = List.of();
    private boolean dispatching;

    private volatile long revision;
    private final AtomicLong savedRevision = new AtomicLong();

    public GraphConfigEngine(DocumentStore store) {
        this(store, null, null);
    }

    /**
     * @param store    persistence backend used by {@link #save()} and {@link #loadDocument(String)}
     * @param catalog  plugin catalog for {@link #addPlugin} and shape checks; null means an empty catalog
     * @param registry meter registry; null means a private {@code SimpleMeterRegistry}
     */
    public GraphConfigEngine(DocumentStore store, PluginCatalog catalog, MeterRegistry registry) {
        this(store, catalog, new DependencyResolver(), registry);
    }

    public GraphConfigEngine(DocumentStore store, PluginCatalog catalog, DependencyResolver dependencyResolver,
                             MeterRegistry registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = catalog != null ? catalog : InMemoryPluginCatalog.of(List.of());
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
        this.metrics = new EngineMetrics(registry);
        this.state = Synchronizer.initialState(ConfigDocument.empty(ConfigDocument.DEFAULT_NAME));
        this.documentText = DocumentJson.toJsonPretty(state.document());
    }

    // --- loading --------------------------------------------------------------------------------

    /** Replaces the whole session with {@code document} and emits a full snapshot. Clears pending changes. */
    public void loadDocument(ConfigDocument document) {
        checkNotDispatching("loadDocument");
        Objects.requireNonNull(document, "document");
        state = Synchronizer.initialState(document);
        documentText = DocumentJson.toJsonPretty(state.document());
        pendingText = null;
        pendingParseError = null;
        selectedNodeId = null;
        lastWarnings = List.of();
        // revisions never restart; a late save of an earlier document stays below the current one
        revision++;
        savedRevision.set(revision);
        List<ReferenceWarning> dangling = getReferenceWarnings();
        log.info("Loaded document {}: {} top-level node(s), {} connection(s), {} dangling reference(s)",
                state.document().getName(), state.graph().getNodes().size(),
                state.graph().getConnections().size(), dangling.size());
        dispatch(snapshotEvents());
    }

    /**
     * Loads {@code name} from the store. Returns false, leaving the session untouched, when the store
     * has no such document or fails.
     */
    public boolean loadDocument(String name) {
        checkNotDispatching("loadDocument");
        Optional<ConfigDocument> loaded;
        try {
            loaded = store.load(name);
        } catch (DocumentStoreException e) {
            log.warn("Failed to load document {}: {}", name, e.getMessage(), e);
            metrics.load(false);
            return false;
        }
        metrics.load(loaded.isPresent());
        if (loaded.isEmpty()) {
            log.info("No stored document named {}", name);
            return false;
        }
        loadDocument(loaded.get());
        return true;
    }

    // --- reads ----------------------------------------------------------------------------------

    public ConfigDocument getDocument() {
        return state.document();
    }

    public GraphModel getGraph() {
        return state.graph();
    }

    public List<Node> getNodes() {
        return state.graph().getNodes();
    }

    public List<Connection> getConnections() {
        return state.graph().getConnections();
    }

    /** Text the document view shows: the pending (unparseable) text if any, else the canonical text. */
    public String getDocumentText() {
        return pendingText != null ? pendingText : documentText;
    }

    public Optional<ParseError> getPendingParseError() {
        return Optional.ofNullable(pendingParseError);
    }

    public Optional<String> getSelectedNodeId() {
        return Optional.ofNullable(selectedNodeId);
    }

    /** Reference values in the current document that name no entry. */
    public List<ReferenceWarning> getReferenceWarnings() {
        return ReferenceResolver.findDanglingReferences(state.document());
    }

    /** Warnings recorded by the most recent edit (coerced params, dropped connections, ...). */
    public List<String> getLastWarnings() {
        return lastWarnings;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.registry();
    }

    // --- graph edits ----------------------------------------------------------------------------

    /** Applies {@code edit}; false only when it targets an unknown node. */
    public boolean applyGraphEdit(GraphEdit edit) {
        return !apply(edit).isNotFound();
    }

    public SyncResult apply(GraphEdit edit) {
        Objects.requireNonNull(edit, "edit");
        checkNotDispatching(edit.type());
        return finish(edit.type(), Synchronizer.apply(edit, state), null);
    }

    public boolean updateParams(String nodeId, Object params) {
        return applyGraphEdit(GraphEdit.updateParams(nodeId, params));
    }

    public boolean removeNode(String nodeId) {
        return applyGraphEdit(GraphEdit.removeNode(nodeId));
    }

    public boolean setConnections(List<Connection> connections) {
        return applyGraphEdit(GraphEdit.setConnections(connections));
    }

    public boolean setNodes(List<Node> nodes) {
        return applyGraphEdit(GraphEdit.setNodes(nodes));
    }

    /** Selects {@code nodeId} (null clears). False when the node does not exist. */
    public boolean selectNode(String nodeId) {
        checkNotDispatching("selectNode");
        if (nodeId != null && state.graph().findNode(nodeId).isEmpty()) {
            return false;
        }
        if (Objects.equals(selectedNodeId, nodeId)) {
            return true;
        }
        selectedNodeId = nodeId;
        dispatch(List.of(new EngineEvent(EngineEventKind.NODE_SELECTED, nodeId)));
        return true;
    }

    // --- text edits -----------------------------------------------------------------------------

    /**
     * Applies an edit of the document text. Unparseable text is held as pending with its parse error
     * and leaves the canonical state alone; text that parses to the current document only replaces the
     * shown text; anything else replaces the document, rebuilds and notifies.
     */
    public TextEditResult applyDocumentText(String text) {
        checkNotDispatching("applyDocumentText");
        DocumentParseResult parsed = DocumentJson.parse(text);
        if (!parsed.isSuccess()) {
            pendingText = text;
            pendingParseError = parsed.getError().orElseThrow();
            log.debug("Document text does not parse: {}", pendingParseError);
            metrics.textEdit(TextEditResult.PARSE_ERROR);
            return TextEditResult.PARSE_ERROR;
        }
        pendingText = null;
        pendingParseError = null;
        ConfigDocument document = parsed.getDocument().orElseThrow();
        if (document.equals(state.document())) {
            documentText = text;
            metrics.textEdit(TextEditResult.UNCHANGED);
            return TextEditResult.UNCHANGED;
        }
        SyncResult result = Synchronizer.apply(GraphEdit.replaceDocument(document), state);
        boolean keepText = result.isApplied() && result.state().document().equals(document);
        finish("documentText", result, keepText ? text : null);
        TextEditResult outcome = result.isApplied() ? TextEditResult.APPLIED : TextEditResult.UNCHANGED;
        metrics.textEdit(outcome);
        return outcome;
    }

    // --- catalog-driven additions ---------------------------------------------------------------

    /**
     * Adds an entry for the catalog plugin {@code pluginName} of {@code role}. Returns
     * {@link SyncOutcome#NOT_FOUND} when the catalog does not know the plugin.
     */
    public SyncResult addPlugin(Role role, String pluginName, String name, Map<String, ?> params) {
        Optional<PluginDescriptor> descriptor = catalog.listPlugins().find(role, pluginName);
        if (descriptor.isEmpty()) {
            checkNotDispatching("addPlugin");
            SyncResult result = new SyncResult(state, SyncOutcome.NOT_FOUND,
                    List.of("Unknown plugin " + pluginName + " for " + role), 0);
            return finish("addPlugin", result, null);
        }
        return addPlugin(descriptor.get(), name, params);
    }

    /**
     * Adds an entry for {@code descriptor}. When the plugin needs a provider or storage and the
     * document has none, a default {@code ai}/{@code storage} entry is added first; the new entry's
     * {@code provider}/{@code storage} params are pre-filled unless {@code params} already sets them.
     * Shape problems with {@code params} are reported as warnings.
     */
    public SyncResult addPlugin(PluginDescriptor descriptor, String name, Map<String, ?> params) {
        Objects.requireNonNull(descriptor, "descriptor");
        checkNotDispatching("addPlugin");
        Role role = descriptor.getRole();
        if (role == null) {
            throw new IllegalArgumentException("Plugin " + descriptor.getPluginName() + " has no role");
        }
        DependencyPlan plan = dependencyResolver.plan(state.document(), descriptor);
        List<String> warnings = new ArrayList<>();

        EngineState working = state;
        int stale = 0;
        ConfigDocument withDependencies = working.document();
        if (plan.getProviderToAdd() != null) {
            withDependencies = withDependencies.withAddedEntry(Role.AI, plan.getProviderToAdd());
            log.info("Adding default ai entry {} for {}", plan.getProviderName(), descriptor.getPluginName());
        }
        if (plan.getStorageToAdd() != null) {
            withDependencies = withDependencies.withAddedEntry(Role.STORAGE, plan.getStorageToAdd());
            log.info("Adding default storage entry {} for {}", plan.getStorageName(), descriptor.getPluginName());
        }
        if (withDependencies != working.document()) {
            SyncResult deps = Synchronizer.apply(GraphEdit.replaceDocument(withDependencies), working);
            warnings.addAll(deps.warnings());
            working = deps.state();
            stale += deps.staleConnectionsRemoved();
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        if (params != null) {
            merged.putAll(params);
        }
        plan.dependencyParams().forEach(merged::putIfAbsent);
        for (ShapeWarning w : ParameterShapeValidator.validate(descriptor, merged)) {
            warnings.add(w.getMessage());
        }
        String entryName = name != null && !name.isBlank() ? name : descriptor.getPluginName();
        PluginEntry entry = PluginEntry.of(descriptor.getPluginName(), entryName, merged, null);
        SyncResult added = Synchronizer.apply(GraphEdit.addEntry(role, entry), working);
        warnings.addAll(added.warnings());
        stale += added.staleConnectionsRemoved();

        SyncOutcome outcome = added.state().equals(state) ? SyncOutcome.UNCHANGED : SyncOutcome.APPLIED;
        return finish("addPlugin", new SyncResult(added.state(), outcome, warnings, stale), null);
    }

    /** Shape problems of a leaf's params against its catalog descriptor; empty when the plugin is unknown. */
    public List<ShapeWarning> validateEntry(String nodeId) {
        Optional<Node> leaf = state.leaf(nodeId);
        if (leaf.isEmpty() || leaf.get().getPluginType() == null) return List.of();
        Optional<PluginEntry> entry = state.entryFor(leaf.get());
        Optional<PluginDescriptor> descriptor = catalog.listPlugins().find(leaf.get().getRole(), leaf.get().getPluginType());
        if (entry.isEmpty() || descriptor.isEmpty()) return List.of();
        return ParameterShapeValidator.validate(descriptor.get(), entry.get().getParams());
    }

    // --- pending changes and persistence --------------------------------------------------------

    /** True while the document has changed since it was loaded or last saved. */
    public boolean hasPendingChanges() {
        return revision != savedRevision.get();
    }

    /** Re-runs the sweep over the current state and re-emits a full snapshot to every subscriber. */
    public void forceSync() {
        checkNotDispatching("forceSync");
        EngineState swept = ConsistencySweep.sweep(state);
        if (!swept.document().equals(state.document())) {
            revision++;
            documentText = DocumentJson.toJsonPretty(swept.document());
        }
        state = swept;
        log.debug("Forced sync of document {}", state.document().getName());
        dispatch(snapshotEvents());
    }

    /**
     * Saves the current document through the store. On success pending changes are cleared; on
     * failure they stay set and false is returned.
     */
    public boolean save() {
        checkNotDispatching("save");
        return persist(state.document(), revision);
    }

    /** Saves on {@code executor}; the engine keeps accepting edits while the save runs. */
    public CompletableFuture<Boolean> saveAsync(Executor executor) {
        checkNotDispatching("saveAsync");
        ConfigDocument document = state.document();
        long rev = revision;
        return CompletableFuture.supplyAsync(() -> persist(document, rev), executor);
    }

    private boolean persist(ConfigDocument document, long rev) {
        try {
            store.save(document.getName(), document);
        } catch (DocumentStoreException e) {
            log.warn("Failed to save document {}: {}", document.getName(), e.getMessage(), e);
            metrics.save(false);
            return false;
        }
        savedRevision.accumulateAndGet(rev, Math::max);
        metrics.save(true);
        log.info("Saved document {} (revision {})", document.getName(), rev);
        return true;
    }

    // --- subscriptions --------------------------------------------------------------------------

    public Subscription subscribe(EngineEventKind kind, EngineListener listener) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(listener, "listener");
        List<EngineListener> list = listeners.computeIfAbsent(kind, k -> new ArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    // --- internals ------------------------------------------------------------------------------

    private SyncResult finish(String type, SyncResult result, String text) {
        lastWarnings = result.warnings();
        for (String warning : result.warnings()) {
            log.warn("{}: {}", type, warning);
        }
        metrics.edit(type, result.outcome());
        metrics.staleConnectionsRemoved(result.staleConnectionsRemoved());
        if (result.isApplied()) {
            commit(result.state(), text);
        }
        return result;
    }

    private void commit(EngineState next, String text) {
        EngineState previous = state;
        state = next;
        List<EngineEvent> events = new ArrayList<>();
        if (!previous.document().equals(next.document())) {
            revision++;
            documentText = text != null ? text : DocumentJson.toJsonPretty(next.document());
            pendingText = null;
            pendingParseError = null;
            events.add(new EngineEvent(EngineEventKind.DOCUMENT_UPDATED, next.document()));
        }
        if (!previous.graph().getNodes().equals(next.graph().getNodes())) {
            events.add(new EngineEvent(EngineEventKind.NODES_UPDATED, next.graph().getNodes()));
        }
        if (!previous.graph().getConnections().equals(next.graph().getConnections())) {
            events.add(new EngineEvent(EngineEventKind.CONNECTIONS_UPDATED, next.graph().getConnections()));
        }
        addEntryUpdates(previous.document(), next.document(), events);
        if (selectedNodeId != null && next.graph().findNode(selectedNodeId).isEmpty()) {
            selectedNodeId = null;
            events.add(new EngineEvent(EngineEventKind.NODE_SELECTED, null));
        }
        dispatch(events);
    }

    /** One event per entry that kept its key but changed content. */
    private static void addEntryUpdates(ConfigDocument before, ConfigDocument after, List<EngineEvent> events) {
        for (Role role : Role.LAYOUT_ORDER) {
            List<PluginEntry> entries = after.entries(role);
            for (int i = 0; i < entries.size(); i++) {
                PluginEntry entry = entries.get(i);
                int old = before.indexOfKey(role, entry.getKey());
                if (old >= 0 && !before.entries(role).get(old).equals(entry)) {
                    events.add(new EngineEvent(EngineEventKind.ENTRY_UPDATED, new EntryUpdate(role.nodeId(i), role, entry)));
                }
            }
        }
    }

    private List<EngineEvent> snapshotEvents() {
        return List.of(
                new EngineEvent(EngineEventKind.DOCUMENT_UPDATED, state.document()),
                new EngineEvent(EngineEventKind.NODES_UPDATED, state.graph().getNodes()),
                new EngineEvent(EngineEventKind.CONNECTIONS_UPDATED, state.graph().getConnections()));
    }

    private void dispatch(List<EngineEvent> events) {
        if (events.isEmpty()) return;
        dispatching = true;
        try {
            for (EngineEvent event : events) {
                List<EngineListener> subscribed = listeners.get(event.kind());
                if (subscribed == null || subscribed.isEmpty()) continue;
                for (EngineListener listener : List.copyOf(subscribed)) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        log.warn("Listener for {} failed: {}", event.kind().getEventName(), e.getMessage(), e);
                    }
                }
            }
        } finally {
            dispatching = false;
        }
    }

    private void checkNotDispatching(String operation) {
        if (dispatching) {
            throw new IllegalStateException(operation
                    + " called from inside an engine listener; queue the edit and apply it after the callback returns");
        }
    }
}

package com.flowgraph.engine.event;

/** Notification kinds a {@link EngineListener} can subscribe to. */
public enum EngineEventKind {
    /** Payload: the new {@code ConfigDocument}. */
    DOCUMENT_UPDATED("document-updated"),
    /** Payload: the new top-level node list. */
    NODES_UPDATED("nodes-updated"),
    /** Payload: the new connection list. */
    CONNECTIONS_UPDATED("connections-updated"),
    /** Payload: the selected node id, or null when the selection was cleared. */
    NODE_SELECTED("node-selected"),
    /** Payload: an {@link EntryUpdate}, once per entry whose content changed. */
    ENTRY_UPDATED("entry-updated");

    private final String eventName;

    EngineEventKind(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}

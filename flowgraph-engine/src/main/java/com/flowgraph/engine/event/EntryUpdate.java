package com.flowgraph.engine.event;

import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;

/** Payload of {@link EngineEventKind#ENTRY_UPDATED}: the leaf id and the entry as it now stands. */
public record EntryUpdate(String nodeId, Role role, PluginEntry entry) {
}

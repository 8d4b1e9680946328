package com.flowgraph.engine.sync;

import java.util.List;

/**
 * State after an edit (the input state unless {@link SyncOutcome#APPLIED}), its outcome, recoverable
 * problems met on the way and how many stale connections the sweep dropped.
 */
public record SyncResult(EngineState state, SyncOutcome outcome, List<String> warnings, int staleConnectionsRemoved) {

    public SyncResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isApplied() {
        return outcome == SyncOutcome.APPLIED;
    }

    public boolean isNotFound() {
        return outcome == SyncOutcome.NOT_FOUND;
    }
}

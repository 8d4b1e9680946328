package com.flowgraph.engine.sync;

/** Result class of one edit. */
public enum SyncOutcome {
    /** The state changed. */
    APPLIED,
    /** The edit reproduced the current state; nothing was written. */
    UNCHANGED,
    /** The edit named a node or entry that does not exist; nothing was written. */
    NOT_FOUND
}

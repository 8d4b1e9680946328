package com.flowgraph.engine.event;

import java.util.Objects;

/**
 * One notification. Fired synchronously, after the consistency sweep, so the payload is always part
 * of a converged state.
 */
public record EngineEvent(EngineEventKind kind, Object payload) {

    public EngineEvent {
        Objects.requireNonNull(kind, "kind");
    }

    /** Payload cast to {@code type}; null payloads stay null. */
    public <T> T payload(Class<T> type) {
        return type.cast(payload);
    }
}

package com.flowgraph.engine.event;

/**
 * Receives engine notifications. Listeners must not call back into the engine's mutating methods;
 * queue further edits and apply them after the callback returns.
 */
@FunctionalInterface
public interface EngineListener {

    void onEvent(EngineEvent event);
}

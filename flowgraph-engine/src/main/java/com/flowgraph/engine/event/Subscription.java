package com.flowgraph.engine.event;

/** Handle returned by {@code subscribe}; unsubscribing twice is harmless. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}

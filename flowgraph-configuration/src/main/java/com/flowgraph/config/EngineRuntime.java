package com.flowgraph.config;

import com.flowgraph.engine.GraphConfigEngine;

import java.util.Objects;
import java.util.Optional;

/** A bootstrapped engine together with the resources it holds. Close it to release the Redis pool. */
public final class EngineRuntime implements AutoCloseable {

    private final FlowGraphConfig config;
    private final GraphConfigEngine engine;
    private final RedisDocumentStore cache;

    EngineRuntime(FlowGraphConfig config, GraphConfigEngine engine, RedisDocumentStore cache) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.cache = cache;
    }

    public FlowGraphConfig getConfig() {
        return config;
    }

    public GraphConfigEngine getEngine() {
        return engine;
    }

    /** The Redis cache, when {@link FlowGraphConfig#isCacheEnabled()}. */
    public Optional<RedisDocumentStore> getCache() {
        return Optional.ofNullable(cache);
    }

    @Override
    public void close() {
        if (cache != null) {
            cache.close();
        }
    }
}

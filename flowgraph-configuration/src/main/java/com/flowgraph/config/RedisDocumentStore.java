package com.flowgraph.config;

import com.flowgraph.document.DocumentJson;
import com.flowgraph.document.DocumentParseResult;
import com.flowgraph.document.load.DocumentKeyBuilder;
import com.flowgraph.document.load.DocumentSink;
import com.flowgraph.document.load.DocumentSource;
import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.store.DocumentStore;
import com.flowgraph.document.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed document cache. As {@link DocumentSource}/{@link DocumentSink} it reads and writes raw
 * JSON by full key for the {@link com.flowgraph.document.load.DocumentLoader}; as {@link DocumentStore}
 * it loads and saves documents by name under {@code <prefix>:<name>}.
 */
public final class RedisDocumentStore implements DocumentSource, DocumentSink, DocumentStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisDocumentStore.class);

    private final JedisPool pool;
    private final DocumentKeyBuilder keyBuilder;

    public RedisDocumentStore(FlowGraphConfig config) {
        this(Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort(), config.getCacheKeyPrefix());
    }

    public RedisDocumentStore(String cacheHost, int cachePort, String keyPrefix) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(cacheHost, "cacheHost"), cachePort), keyPrefix);
        log.debug("RedisDocumentStore connected to {}:{}", cacheHost, cachePort);
    }

    RedisDocumentStore(JedisPool pool, String keyPrefix) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keyBuilder = new DocumentKeyBuilder(keyPrefix);
    }

    @Override
    public Optional<String> get(String key) {
        try (var jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(key));
        }
    }

    @Override
    public void put(String key, String json) {
        try (var jedis = pool.getResource()) {
            jedis.set(key, json);
            log.debug("Wrote document to Redis key={}", key);
        }
    }

    @Override
    public Optional<ConfigDocument> load(String name) {
        String key = keyBuilder.key(name);
        Optional<String> json;
        try {
            json = get(key);
        } catch (JedisException e) {
            throw new DocumentStoreException("Failed to read document " + name + " from Redis key " + key, e);
        }
        if (json.isEmpty()) {
            return Optional.empty();
        }
        DocumentParseResult parsed = DocumentJson.parse(json.get());
        if (!parsed.isSuccess()) {
            throw new DocumentStoreException("Document at Redis key " + key + " does not parse: "
                    + parsed.getError().orElseThrow());
        }
        return parsed.getDocument();
    }

    @Override
    public void save(String name, ConfigDocument document) {
        Objects.requireNonNull(document, "document");
        String key = keyBuilder.key(name);
        try {
            put(key, DocumentJson.toJson(document));
        } catch (JedisException e) {
            throw new DocumentStoreException("Failed to save document " + name + " to Redis key " + key, e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}

package com.flowgraph.document.load;

/**
 * Sink for document JSON. When a document is loaded from a local file, the loader writes it back
 * through this interface so other processes find it in the cache.
 */
public interface DocumentSink {

    /**
     * Writes document JSON under the given key.
     *
     * @param key  full key (e.g. from {@link DocumentKeyBuilder#key(String)})
     * @param json document JSON
     */
    void put(String key, String json);
}

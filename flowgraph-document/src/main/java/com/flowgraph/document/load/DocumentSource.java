package com.flowgraph.document.load;

import java.util.Optional;

/**
 * Source for document JSON held outside the local config directory (e.g. a Redis cache).
 * Implementations are provided by the runtime (see flowgraph-configuration).
 */
public interface DocumentSource {

    /**
     * Gets document JSON by key.
     *
     * @param key full key (e.g. from {@link DocumentKeyBuilder#key(String)})
     * @return document JSON if present
     */
    Optional<String> get(String key);
}

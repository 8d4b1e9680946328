package com.flowgraph.config;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.store.DocumentStore;
import com.flowgraph.document.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * A primary store (the files) fronted by a cache (Redis). Loads try the cache first and fall back to
 * the primary, writing what the primary returned back to the cache. Saves go to the primary, then to
 * the cache. Cache failures are logged and never fail the operation; primary failures propagate.
 */
public final class LayeredDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(LayeredDocumentStore.class);

    private final DocumentStore primary;
    private final DocumentStore cache;

    public LayeredDocumentStore(DocumentStore primary, DocumentStore cache) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public Optional<ConfigDocument> load(String name) {
        try {
            Optional<ConfigDocument> cached = cache.load(name);
            if (cached.isPresent()) {
                log.debug("Document {} loaded from cache", name);
                return cached;
            }
        } catch (DocumentStoreException e) {
            log.warn("Cache read failed for document {}: {}", name, e.getMessage());
        }
        Optional<ConfigDocument> doc = primary.load(name);
        doc.ifPresent(d -> writeToCache(name, d));
        return doc;
    }

    @Override
    public void save(String name, ConfigDocument document) {
        primary.save(name, document);
        writeToCache(name, document);
    }

    private void writeToCache(String name, ConfigDocument document) {
        try {
            cache.save(name, document);
        } catch (DocumentStoreException e) {
            log.warn("Cache write failed for document {}: {}", name, e.getMessage());
        }
    }
}

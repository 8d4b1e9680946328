package com.flowgraph.config;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.Role;
import com.flowgraph.document.store.DocumentStore;
import com.flowgraph.document.store.DocumentStoreException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LayeredDocumentStoreTest {

    private static final ConfigDocument DOC = ConfigDocument.builder("digest")
            .add(Role.SOURCES, "hn", Map.of("url", "https://news.ycombinator.com/rss"))
            .build();

    @Test
    void cacheHitSkipsPrimary() {
        MapStore primary = new MapStore();
        MapStore cache = new MapStore();
        cache.docs.put("digest", DOC);

        Optional<ConfigDocument> loaded = new LayeredDocumentStore(primary, cache).load("digest");

        assertEquals(Optional.of(DOC), loaded);
        assertEquals(0, primary.loads);
    }

    @Test
    void cacheMissLoadsPrimaryAndWritesBack() {
        MapStore primary = new MapStore();
        MapStore cache = new MapStore();
        primary.docs.put("digest", DOC);

        Optional<ConfigDocument> loaded = new LayeredDocumentStore(primary, cache).load("digest");

        assertEquals(Optional.of(DOC), loaded);
        assertEquals(DOC, cache.docs.get("digest"));
    }

    @Test
    void missingEverywhereIsEmpty() {
        assertTrue(new LayeredDocumentStore(new MapStore(), new MapStore()).load("nope").isEmpty());
    }

    @Test
    void saveWritesBoth() {
        MapStore primary = new MapStore();
        MapStore cache = new MapStore();

        new LayeredDocumentStore(primary, cache).save("digest", DOC);

        assertEquals(DOC, primary.docs.get("digest"));
        assertEquals(DOC, cache.docs.get("digest"));
    }

    @Test
    void brokenCacheDoesNotFailLoadOrSave() {
        MapStore primary = new MapStore();
        primary.docs.put("digest", DOC);
        LayeredDocumentStore store = new LayeredDocumentStore(primary, new BrokenStore());

        assertEquals(Optional.of(DOC), store.load("digest"));
        store.save("other", DOC);
        assertEquals(DOC, primary.docs.get("other"));
    }

    @Test
    void primaryFailurePropagates() {
        LayeredDocumentStore store = new LayeredDocumentStore(new BrokenStore(), new MapStore());

        assertThrows(DocumentStoreException.class, () -> store.save("digest", DOC));
        assertThrows(DocumentStoreException.class, () -> store.load("digest"));
    }

    private static final class MapStore implements DocumentStore {
        final Map<String, ConfigDocument> docs = new HashMap<>();
        int loads;

        @Override
        public Optional<ConfigDocument> load(String name) {
            loads++;
            return Optional.ofNullable(docs.get(name));
        }

        @Override
        public void save(String name, ConfigDocument document) {
            docs.put(name, document);
        }
    }

    private static final class BrokenStore implements DocumentStore {
        @Override
        public Optional<ConfigDocument> load(String name) {
            throw new DocumentStoreException("connection refused");
        }

        @Override
        public void save(String name, ConfigDocument document) {
            throw new DocumentStoreException("connection refused");
        }
    }
}

package com.flowgraph.document.load;

import com.flowgraph.document.DocumentJson;
import com.flowgraph.document.DocumentParseResult;
import com.flowgraph.document.model.ConfigDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads a pipeline document in order: cache ({@link DocumentSource}) → {@code <name>.json} in the
 * config directory → {@code default.json}. If none is available, waits for the configured retry
 * seconds and repeats; with no retry configured it fails fast.
 * <p>
 * A document found in a local file is written back through the {@link DocumentSink} (when set)
 * so other processes pick it up from the cache.
 */
public final class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final String DEFAULT_DOCUMENT_FILE = "default.json";

    private final DocumentSource source;
    private final DocumentSink sink;
    private final Path configDir;
    private final int retryWaitSeconds;
    private final DocumentKeyBuilder keyBuilder;

    /**
     * @param source           cache source (may return empty); null = no cache
     * @param sink             when non-null, documents read from local files are written to the cache
     * @param configDir        directory for local document files; null = no local files
     * @param retryWaitSeconds seconds to wait before retrying when nothing is found; 0 = fail fast
     * @param keyPrefix        cache key prefix; null = {@link DocumentKeyBuilder#DEFAULT_PREFIX}
     */
    public DocumentLoader(DocumentSource source, DocumentSink sink, Path configDir,
                          int retryWaitSeconds, String keyPrefix) {
        this.source = source;
        this.sink = sink;
        this.configDir = configDir;
        this.retryWaitSeconds = Math.max(0, retryWaitSeconds);
        this.keyBuilder = new DocumentKeyBuilder(keyPrefix);
    }

    /**
     * Loads the document {@code name}, retrying until one is found when a retry wait is configured.
     *
     * @return the document (never null)
     * @throws IllegalStateException when nothing is found and no retry wait is configured, or when
     *                               interrupted while waiting
     */
    public ConfigDocument loadDocument(String name) {
        while (true) {
            Optional<ConfigDocument> doc = tryLoadOnce(name);
            if (doc.isPresent()) {
                return doc.get();
            }
            if (retryWaitSeconds == 0) {
                throw new IllegalStateException("No document found for name=" + name
                        + " (cache, " + name + ".json, " + DEFAULT_DOCUMENT_FILE + ")");
            }
            log.warn("No document found for name={}; retrying in {}s", name, retryWaitSeconds);
            try {
                Thread.sleep(retryWaitSeconds * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for document " + name, e);
            }
        }
    }

    /** One attempt: cache → {@code name.json} → {@code default.json}. Empty if none found or all failed to parse. */
    public Optional<ConfigDocument> tryLoadOnce(String name) {
        String key = keyBuilder.key(name);
        if (source != null) {
            Optional<String> json = safeCacheLoad(key);
            if (json.isPresent()) {
                Optional<ConfigDocument> doc = parse(json.get(), "cache:" + key);
                if (doc.isPresent()) {
                    log.info("Document loaded from cache key={} for name={}", key, name);
                    return doc;
                }
            }
        }
        Optional<ConfigDocument> doc = tryLoadFromLocalFile(name + ".json", key, "");
        if (doc.isPresent()) return doc;
        return tryLoadFromLocalFile(DEFAULT_DOCUMENT_FILE, key, " (default)");
    }

    private Optional<ConfigDocument> tryLoadFromLocalFile(String fileName, String key, String logSuffix) {
        Optional<String> json = readLocalFile(fileName);
        if (json.isEmpty()) return Optional.empty();
        Optional<ConfigDocument> doc = parse(json.get(), "file:" + fileName);
        if (doc.isEmpty()) return Optional.empty();
        log.info("Document loaded from file: {}{}", configDir.resolve(fileName), logSuffix);
        if (sink != null) {
            writeBack(key, doc.get());
        }
        return doc;
    }

    private void writeBack(String key, ConfigDocument doc) {
        try {
            sink.put(key, DocumentJson.toJson(doc));
            log.info("Document {} written to cache key={}", doc.getName(), key);
        } catch (RuntimeException e) {
            log.warn("Failed to write document {} to cache key={}: {}", doc.getName(), key, e.getMessage());
        }
    }

    private Optional<String> safeCacheLoad(String key) {
        try {
            return source.get(key);
        } catch (RuntimeException e) {
            log.warn("Failed to read document from cache key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ConfigDocument> parse(String json, String from) {
        DocumentParseResult result = DocumentJson.parse(json);
        if (!result.isSuccess()) {
            log.warn("Failed to parse document from {}: {}", from, result.getError().orElseThrow());
        }
        return result.getDocument();
    }

    private Optional<String> readLocalFile(String fileName) {
        if (configDir == null) {
            return Optional.empty();
        }
        Path file = configDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read document file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}

package com.flowgraph.document.store;

import com.flowgraph.document.DocumentJson;
import com.flowgraph.document.model.ConfigDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each document as pretty-printed {@code <name>.json} in one directory. Writes go to a
 * temporary file first and are moved into place.
 */
public final class FileDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private final Path directory;

    public FileDocumentStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<ConfigDocument> load(String name) {
        Path file = fileFor(name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(DocumentJson.fromJson(Files.readString(file)));
        } catch (IOException | UncheckedIOException e) {
            throw new DocumentStoreException("Failed to read document " + name + " from " + file, e);
        }
    }

    @Override
    public void save(String name, ConfigDocument document) {
        Objects.requireNonNull(document, "document");
        Path file = fileFor(name);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, name, ".tmp");
            Files.writeString(tmp, DocumentJson.toJsonPretty(document));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("Document {} saved to {}", name, file);
        } catch (IOException | UncheckedIOException e) {
            DocumentStoreException failure = new DocumentStoreException("Failed to save document " + name + " to " + file, e);
            deleteTempFile(tmp, failure);
            throw failure;
        }
    }

    private static void deleteTempFile(Path tmp, DocumentStoreException failure) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
            failure.addSuppressed(e);
        }
    }

    private Path fileFor(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Invalid document name: " + name);
        }
        return directory.resolve(name + ".json");
    }
}

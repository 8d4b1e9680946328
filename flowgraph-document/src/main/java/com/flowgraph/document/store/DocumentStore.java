package com.flowgraph.document.store;

import com.flowgraph.document.model.ConfigDocument;

import java.util.Optional;

/**
 * Persistence backend for documents, addressed by document name.
 */
public interface DocumentStore {

    /**
     * @return the stored document, or empty when none exists under {@code name}
     * @throws DocumentStoreException when the backend fails or holds unreadable content
     */
    Optional<ConfigDocument> load(String name);

    /**
     * Stores {@code document} under {@code name}, replacing any previous version.
     *
     * @throws DocumentStoreException when the backend fails
     */
    void save(String name, ConfigDocument document);
}

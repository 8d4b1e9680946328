package com.flowgraph.document.store;

/**
 * Raised by a {@link DocumentStore} when a document cannot be read or written.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

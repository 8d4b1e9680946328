package com.flowgraph.document.load;

/**
 * Builds the cache key for a document: {@code <prefix>:<name>}, e.g. {@code flowgraph:document:news}.
 */
public final class DocumentKeyBuilder {

    public static final String DEFAULT_PREFIX = "flowgraph:document";

    private final String prefix;

    public DocumentKeyBuilder(String prefix) {
        this.prefix = prefix != null && !prefix.isBlank() ? prefix.trim() : DEFAULT_PREFIX;
    }

    /** Full key for the document name; a null name is treated as empty. */
    public String key(String documentName) {
        return prefix + ":" + (documentName != null ? documentName : "");
    }

    public static String key(String prefix, String documentName) {
        return new DocumentKeyBuilder(prefix).key(documentName);
    }
}

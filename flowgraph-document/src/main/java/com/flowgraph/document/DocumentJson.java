package com.flowgraph.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.document.model.ConfigDocument;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of {@link ConfigDocument}s.
 * JSON excludes null properties when serializing; null values inside {@code params} are kept.
 */
public final class DocumentJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private DocumentJson() {
    }

    /**
     * Deserializes a document from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static ConfigDocument fromJson(String json) {
        try {
            ConfigDocument doc = MAPPER.readValue(json, ConfigDocument.class);
            if (doc == null) {
                throw new IOException("Document JSON is null");
            }
            return doc;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the document to compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(ConfigDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Serializes the document to pretty-printed JSON; this is the canonical text shown in editors.
     */
    public static String toJsonPretty(ConfigDocument document) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Parses user-edited text. Never throws for bad input: syntax and shape problems come back as a
     * {@link ParseError} carrying the parser's line and column.
     */
    public static DocumentParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return DocumentParseResult.failure(new ParseError("Document text is empty", 1, 1));
        }
        try {
            ConfigDocument doc = MAPPER.readValue(text, ConfigDocument.class);
            if (doc == null) {
                return DocumentParseResult.failure(new ParseError("Document must be a JSON object", 1, 1));
            }
            return DocumentParseResult.success(doc);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            int line = loc != null ? loc.getLineNr() : 0;
            int column = loc != null ? loc.getColumnNr() : 0;
            String message = e.getOriginalMessage() != null ? e.getOriginalMessage() : String.valueOf(e.getMessage());
            return DocumentParseResult.failure(new ParseError(message, line, column));
        }
    }

    /**
     * Returns a document where every entry has a stable internal key (see
     * {@link com.flowgraph.document.model.PluginEntry#getKey()}). Existing keys are kept.
     */
    public static ConfigDocument ensureEntryKeys(ConfigDocument document) {
        if (document == null) return null;
        return document.withEntryKeys();
    }
}

package com.flowgraph.document;

import com.flowgraph.document.model.ConfigDocument;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link DocumentJson#parse(String)}: either a document or a {@link ParseError}.
 */
public final class DocumentParseResult {

    private final ConfigDocument document;
    private final ParseError error;

    private DocumentParseResult(ConfigDocument document, ParseError error) {
        this.document = document;
        this.error = error;
    }

    public static DocumentParseResult success(ConfigDocument document) {
        return new DocumentParseResult(Objects.requireNonNull(document, "document"), null);
    }

    public static DocumentParseResult failure(ParseError error) {
        return new DocumentParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return document != null;
    }

    public Optional<ConfigDocument> getDocument() {
        return Optional.ofNullable(document);
    }

    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }
}

package com.flowgraph.engine;

/** Outcome of {@link GraphConfigEngine#applyDocumentText(String)}. */
public enum TextEditResult {
    /** The text parsed to a different document, which is now canonical. */
    APPLIED,
    /** The text parsed to the current document (formatting only); nothing downstream ran. */
    UNCHANGED,
    /** The text does not parse; it is held as pending and the canonical state is untouched. */
    PARSE_ERROR
}

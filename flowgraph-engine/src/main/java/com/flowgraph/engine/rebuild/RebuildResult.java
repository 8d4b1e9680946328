package com.flowgraph.engine.rebuild;

import com.flowgraph.engine.graph.GraphModel;
import com.flowgraph.engine.reference.ReferenceWarning;

import java.util.List;

/**
 * Graph derived from a document plus the dangling references found while deriving it.
 */
public record RebuildResult(GraphModel graph, List<ReferenceWarning> warnings) {

    public RebuildResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}

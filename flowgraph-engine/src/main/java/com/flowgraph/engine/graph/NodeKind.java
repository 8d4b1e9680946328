package com.flowgraph.engine.graph;

/** Leaf nodes mirror one document entry; group nodes are synthetic parents of one grouped role. */
public enum NodeKind {
    LEAF,
    GROUP
}

package com.flowgraph.engine.graph;

/** Canvas position of a node. */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}

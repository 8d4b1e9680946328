package com.flowgraph.engine.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Directed edge from an output port to an input port:
 * {@code { "from": {"nodeId", "output"}, "to": {"nodeId", "input"} }}.
 * A connection is the graph form of a {@code provider}/{@code storage} parameter on the target.
 */
public final class Connection {

    private final Source from;
    private final Target to;

    @JsonCreator
    public Connection(@JsonProperty("from") Source from, @JsonProperty("to") Target to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public static Connection of(String fromNodeId, String output, String toNodeId, String input) {
        return new Connection(new Source(fromNodeId, output), new Target(toNodeId, input));
    }

    public Source getFrom() {
        return from;
    }

    public Target getTo() {
        return to;
    }

    /** True if this connection ends at input {@code input} of {@code nodeId}. */
    public boolean targets(String nodeId, String input) {
        return to.getNodeId().equals(nodeId) && to.getInput().equals(input);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from.getNodeId() + "." + from.getOutput() + " -> " + to.getNodeId() + "." + to.getInput();
    }

    /** Output end of a connection. */
    public static final class Source {
        private final String nodeId;
        private final String output;

        @JsonCreator
        public Source(@JsonProperty("nodeId") String nodeId, @JsonProperty("output") String output) {
            this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
            this.output = Objects.requireNonNull(output, "output");
        }

        public String getNodeId() {
            return nodeId;
        }

        public String getOutput() {
            return output;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Source that = (Source) o;
            return nodeId.equals(that.nodeId) && output.equals(that.output);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeId, output);
        }
    }

    /** Input end of a connection. */
    public static final class Target {
        private final String nodeId;
        private final String input;

        @JsonCreator
        public Target(@JsonProperty("nodeId") String nodeId, @JsonProperty("input") String input) {
            this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
            this.input = Objects.requireNonNull(input, "input");
        }

        public String getNodeId() {
            return nodeId;
        }

        public String getInput() {
            return input;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Target that = (Target) o;
            return nodeId.equals(that.nodeId) && input.equals(that.input);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeId, input);
        }
    }
}

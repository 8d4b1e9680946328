package com.flowgraph.engine.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Named connection point on a leaf node. {@code portKind} is {@code provider} or {@code storage};
 * only an output and an input of the same kind can be connected. On input ports {@code connectedTo}
 * holds the id of the connected source node (null when unconnected); output ports fan out and leave
 * it null.
 */
public final class Port {

    private final String name;
    private final String portKind;
    private final String connectedTo;

    @JsonCreator
    public Port(
            @JsonProperty("name") String name,
            @JsonProperty("portKind") String portKind,
            @JsonProperty("connectedTo") String connectedTo) {
        this.name = Objects.requireNonNull(name, "name");
        this.portKind = portKind != null ? portKind : name;
        this.connectedTo = connectedTo;
    }

    public static Port of(String name, String portKind) {
        return new Port(name, portKind, null);
    }

    public String getName() {
        return name;
    }

    public String getPortKind() {
        return portKind;
    }

    public String getConnectedTo() {
        return connectedTo;
    }

    public boolean isConnected() {
        return connectedTo != null;
    }

    public Port withConnectedTo(String nodeId) {
        return Objects.equals(connectedTo, nodeId) ? this : new Port(name, portKind, nodeId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Port port = (Port) o;
        return name.equals(port.name) && portKind.equals(port.portKind) && Objects.equals(connectedTo, port.connectedTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, portKind, connectedTo);
    }

    @Override
    public String toString() {
        return name + "(" + portKind + (connectedTo != null ? " <- " + connectedTo : "") + ")";
    }
}

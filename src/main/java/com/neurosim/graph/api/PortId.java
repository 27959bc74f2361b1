package com.neurosim.graph.api;

/**
 * Handle of a port: the owning node, the port kind and the port's position in
 * the owner's list of ports of that kind.
 */
public record PortId(NodeId node, PortKind kind, int index) {

    public static PortId input(NodeId node, int index) {
        return new PortId(node, PortKind.INPUT, index);
    }

    public static PortId parameter(NodeId node, int index) {
        return new PortId(node, PortKind.PARAMETER, index);
    }

    public static PortId output(NodeId node, int index) {
        return new PortId(node, PortKind.OUTPUT, index);
    }

    @Override
    public String toString() {
        return node.name() + "." + kind.name().toLowerCase() + "[" + index + "]";
    }
}

package com.g2c.compiler.ir;

/**
 * A (nodeId, port) pair. Ordered by node id, then port name.
 */
public record PortRef(String nodeId, String port) implements Comparable<PortRef> {

    @Override
    public int compareTo(PortRef other) {
        int byNode = nodeId.compareTo(other.nodeId);
        return byNode != 0 ? byNode : port.compareTo(other.port);
    }

    @Override
    public String toString() {
        return nodeId + ":" + port;
    }
}

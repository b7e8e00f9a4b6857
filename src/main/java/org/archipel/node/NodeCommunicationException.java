package org.archipel.node;

/**
 * Thrown when an exchange with a peer node fails during a run.
 */
public class NodeCommunicationException extends RuntimeException {

    private final NodeId node;

    public NodeCommunicationException(NodeId node, String message) {
        super(String.format("communication with node %s failed: %s", node, message));
        this.node = node;
    }

    public NodeCommunicationException(NodeId node, String message, Throwable cause) {
        super(String.format("communication with node %s failed: %s", node, message), cause);
        this.node = node;
    }

    public NodeId getNode() {
        return node;
    }
}

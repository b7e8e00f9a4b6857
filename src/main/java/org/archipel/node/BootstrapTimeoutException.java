package org.archipel.node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the bootstrap handshake between leader and workers does not complete in time.
 */
public class BootstrapTimeoutException extends RuntimeException {

    private final List<NodeId> disconnectedNodes;
    private final List<NodeId> unconfirmedNodes;

    /**
     * Leader side: some nodes never answered, others answered but host no worker.
     *
     * @param disconnectedNodes Nodes that could not be reached.
     * @param unconfirmedNodes  Reachable nodes without a registered worker.
     */
    public BootstrapTimeoutException(List<NodeId> disconnectedNodes, List<NodeId> unconfirmedNodes) {
        super(leaderMessage(disconnectedNodes, unconfirmedNodes));
        this.disconnectedNodes = List.copyOf(disconnectedNodes);
        this.unconfirmedNodes = List.copyOf(unconfirmedNodes);
    }

    /**
     * Worker side: no leader initiated the connection.
     */
    public BootstrapTimeoutException(String message) {
        super(message);
        this.disconnectedNodes = List.of();
        this.unconfirmedNodes = List.of();
    }

    public List<NodeId> disconnectedNodes() {
        return disconnectedNodes;
    }

    public List<NodeId> unconfirmedNodes() {
        return unconfirmedNodes;
    }

    private static String leaderMessage(List<NodeId> disconnected, List<NodeId> unconfirmed) {
        StringBuilder message = new StringBuilder(
            "failed to establish connection to all workers within the given time limit");
        if (!disconnected.isEmpty()) {
            message.append("\n\n  * could not connect to the following nodes: ").append(join(disconnected));
        }
        if (!unconfirmed.isEmpty()) {
            message.append("\n\n  * no worker process found on the following nodes: ").append(join(unconfirmed));
        }
        return message.toString();
    }

    private static String join(List<NodeId> nodes) {
        return nodes.stream().map(NodeId::toString).collect(Collectors.joining(", "));
    }
}

package org.archipel.runner;

import org.archipel.node.NodeId;

import java.io.Serializable;

/**
 * Addresses the worker evolving population {@code index} on {@code node}.
 *
 * @param node  The node hosting the worker.
 * @param index The population index within the run.
 */
public record WorkerAddress(NodeId node, int index) implements Serializable {

    public WorkerAddress {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
    }

    @Override
    public String toString() {
        return "#" + index + "@" + node;
    }
}

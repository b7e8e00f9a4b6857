package org.archipel.node.dto;

import org.archipel.node.NodeId;

/**
 * Sent by the leader to the process registered under {@code name}.
 *
 * @param name   The registered name, {@code worker} for worker processes.
 * @param leader The leader node.
 */
public record InitiateRequestDto(String name, NodeId leader) {
}

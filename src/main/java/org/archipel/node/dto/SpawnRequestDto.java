package org.archipel.node.dto;

import org.archipel.node.NodeId;

import java.util.List;

/**
 * Asks a node to host populations of a run.
 *
 * @param leader        The node coordinating the run; reports go there.
 * @param providerClass The model provider class.
 * @param options       The model provider options as HOCON.
 * @param indices       The population indices to host.
 */
public record SpawnRequestDto(NodeId leader, String providerClass, String options, List<Integer> indices) {
}

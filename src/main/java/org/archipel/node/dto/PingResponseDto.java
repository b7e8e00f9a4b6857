package org.archipel.node.dto;

/**
 * @param node   The responding node, as {@code name@host:port}.
 * @param status Always {@code UP}.
 * @param runs   The number of runs hosted by the node.
 */
public record PingResponseDto(String node, String status, int runs) {
}

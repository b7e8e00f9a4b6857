package org.archipel.node.dto;

import org.archipel.runner.WorkerAddress;

import java.util.List;

public record SpawnResponseDto(List<WorkerAddress> workers) {
}

package org.archipel.migration;

import org.archipel.runner.WorkerAddress;

import java.io.Serializable;

/**
 * A batch of emigrant genomes travelling from one population to another.
 *
 * @param sender     The emigrating worker.
 * @param generation The sender's generation at emigration time.
 * @param genomes    The emigrant genomes, in the sender's representation.
 */
public record Migrants(WorkerAddress sender, int generation, Object genomes) implements Serializable {
}

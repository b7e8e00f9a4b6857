package org.archipel.migration;

import org.archipel.runner.WorkerAddress;

/**
 * Delivers migrant batches to the mailbox of a worker, wherever it runs.
 */
@FunctionalInterface
public interface IMessageRouter {

    /**
     * Delivers the batch without blocking the sender for longer than a network round trip.
     *
     * @param target   The receiving worker.
     * @param migrants The batch.
     */
    void deliver(WorkerAddress target, Migrants migrants);
}

package org.archipel.node;

import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Migrants;
import org.archipel.runner.WorkerAddress;

/**
 * Delivers migrants to workers on other nodes through their node server.
 */
class HttpMessageRouter implements IMessageRouter {

    private final ClusterClient client;
    private final String runId;

    HttpMessageRouter(final ClusterClient client, final String runId) {
        this.client = client;
        this.runId = runId;
    }

    @Override
    public void deliver(final WorkerAddress target, final Migrants migrants) {
        client.sendMigrants(target, runId, migrants);
    }
}

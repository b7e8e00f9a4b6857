package org.archipel.runner;

import org.archipel.migration.IMessageRouter;
import org.archipel.node.ModelSource;
import org.archipel.node.NodeId;

import java.util.List;

/**
 * What the {@link Runner} needs from the cluster to place populations on other nodes.
 */
public interface IClusterGateway {

    /**
     * @return The node this process runs as.
     */
    NodeId self();

    /**
     * Delivers migrants from local workers to workers hosted by other nodes.
     */
    IMessageRouter remoteRouter(String runId);

    /**
     * Makes a run hosted by this process reachable for peers: incoming migrants go to
     * {@code localRun}, incoming reports and failures go to {@code tracker} (which may be
     * {@code null} on nodes that do not coordinate the run).
     */
    void host(LocalRun localRun, IReportSink tracker);

    void release(String runId);

    /**
     * Asks {@code node} to rebuild the model from {@code source} and spawn workers for the
     * given population indices.
     *
     * @return The addresses of the spawned workers.
     */
    List<WorkerAddress> spawn(NodeId node, String runId, ModelSource source, List<Integer> indices);

    void sendRoster(NodeId node, Roster roster);

    /**
     * Asks {@code node} to interrupt its workers of the run. Failures are logged, not thrown.
     */
    void cancel(NodeId node, String runId);
}

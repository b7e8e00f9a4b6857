package org.archipel.node;

import com.typesafe.config.Config;
import org.archipel.migration.IMessageRouter;
import org.archipel.node.dto.SpawnRequestDto;
import org.archipel.runner.IClusterGateway;
import org.archipel.runner.IReportSink;
import org.archipel.runner.LocalRun;
import org.archipel.runner.Roster;
import org.archipel.runner.WorkerAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ObjectInputFilter;
import java.time.Duration;
import java.util.List;

/**
 * This process's membership in a cluster: its node server, the names it registers, the runs
 * it hosts and the client it uses to reach peers.
 */
public class Cluster implements IClusterGateway, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Cluster.class);

    private final String name;
    private final String host;
    private final Config runnerOptions;
    private final int reportAttempts;
    private final Duration reportRetryGap;
    private final ObjectInputFilter payloadFilter;
    private final ClusterClient client;
    private final NameDirectory directory = new NameDirectory();
    private final RunRegistry registry = new RunRegistry();
    private final NodeServer server;
    private volatile NodeId self;

    /**
     * @param archipel The {@code archipel} configuration section.
     */
    public Cluster(final Config archipel) {
        final Config node = archipel.getConfig("node");
        this.name = node.getString("name");
        this.host = node.getString("host");
        this.runnerOptions = archipel.getConfig("runner");
        final Config http = node.getConfig("http");
        this.client = new ClusterClient(http);
        this.reportAttempts = http.getInt("report-attempts");
        this.reportRetryGap = http.getDuration("report-retry-gap");
        if (reportAttempts < 1) {
            throw new IllegalArgumentException("archipel.node.http.report-attempts must be at least 1, got: " + reportAttempts);
        }
        final Config payload = node.getConfig("payload");
        this.payloadFilter = PayloadCodec.filter(payload.getStringList("allowed-classes"),
            payload.getInt("max-depth"), payload.getLong("max-array-length"));
        this.server = new NodeServer(name, host, node.getInt("port"),
            List.of(new NodeController(this), new RunController(this)));
    }

    /**
     * Starts the node server. The node identity includes the actual port, which matters
     * when the configured port is 0.
     *
     * @return The identity of this node.
     */
    public NodeId start() {
        final int port = server.start();
        self = new NodeId(name, host, port);
        LOGGER.info("Node {} is up", self);
        return self;
    }

    @Override
    public void close() {
        server.stop();
        LOGGER.debug("Node {} is down", self);
    }

    @Override
    public NodeId self() {
        final NodeId current = self;
        if (current == null) {
            throw new IllegalStateException("node '" + name + "' has not been started");
        }
        return current;
    }

    public ClusterClient client() {
        return client;
    }

    public NameDirectory directory() {
        return directory;
    }

    public RunRegistry registry() {
        return registry;
    }

    public Config runnerOptions() {
        return runnerOptions;
    }

    /**
     * @return How often a population report is sent to the coordinating node before it is
     *         replaced by a failure.
     */
    public int reportAttempts() {
        return reportAttempts;
    }

    public Duration reportRetryGap() {
        return reportRetryGap;
    }

    /**
     * @return The filter applied to serialized payloads received from peers.
     */
    public ObjectInputFilter payloadFilter() {
        return payloadFilter;
    }

    @Override
    public IMessageRouter remoteRouter(final String runId) {
        return new HttpMessageRouter(client, runId);
    }

    @Override
    public void host(final LocalRun localRun, final IReportSink tracker) {
        registry.host(localRun, tracker);
    }

    @Override
    public void release(final String runId) {
        registry.release(runId);
    }

    @Override
    public List<WorkerAddress> spawn(final NodeId node, final String runId, final ModelSource source,
                                     final List<Integer> indices) {
        LOGGER.debug("Spawning populations {} of run {} on {}", indices, runId, node);
        return client.spawn(node, runId,
            new SpawnRequestDto(self(), source.providerClass(), source.options(), indices));
    }

    @Override
    public void sendRoster(final NodeId node, final Roster roster) {
        client.sendRoster(node, roster);
    }

    @Override
    public void cancel(final NodeId node, final String runId) {
        try {
            client.cancel(node, runId);
        } catch (final NodeCommunicationException e) {
            LOGGER.warn("Failed to cancel run {} on {}: {}", runId, node, e.getMessage());
        }
    }
}

package org.archipel.runner;

import com.typesafe.config.Config;
import org.archipel.evolution.ConfigurationException;
import org.archipel.evolution.Model;
import org.archipel.node.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Runs a model: one worker per population, started together, released by a shared roster
 * and joined once every population has terminated.
 *
 * <p>Without a cluster gateway all populations run in this process. With one, populations
 * can be placed on other nodes; those nodes rebuild the model from
 * {@link RunOptions#modelSource()}.</p>
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);
    private static final NodeId LOCAL_NODE = new NodeId("local", "localhost", 0);

    private final Config runnerOptions;
    private final IClusterGateway cluster;

    /**
     * Creates a runner for local runs.
     *
     * @param runnerOptions The {@code archipel.runner} configuration section.
     */
    public Runner(Config runnerOptions) {
        this(runnerOptions, null);
    }

    public Runner(Config runnerOptions, IClusterGateway cluster) {
        this.runnerOptions = runnerOptions;
        this.cluster = cluster;
    }

    public Report run(Model model) throws InterruptedException {
        return run(model, RunOptions.local());
    }

    /**
     * Runs the model to completion.
     *
     * @param model   The model to run.
     * @param options Where to place the populations.
     * @return The report with one entry per population, ordered by population index.
     * @throws RunFailedException     if a population worker fails; the cause is the worker's exception.
     * @throws ConfigurationException if the placement is invalid.
     * @throws InterruptedException   if interrupted while waiting for the populations.
     */
    public Report run(Model model, RunOptions options) throws InterruptedException {
        NodeId self = cluster == null ? LOCAL_NODE : cluster.self();
        List<NodeId> nodes = options.nodes().isEmpty() ? List.of(self) : options.nodes();
        List<List<Integer>> groups = options.resolveGroups(model.numPopulations(), nodes.size());
        validatePlacement(self, nodes, options);

        String runId = UUID.randomUUID().toString();
        RunTracker tracker = new RunTracker(runId, model.numPopulations());
        LocalRun localRun = null;
        List<NodeId> remoteNodes = new ArrayList<>();
        log.info("Starting run {} with {} populations on {} node(s)", runId, model.numPopulations(), nodes.size());

        long start = System.nanoTime();
        try {
            WorkerAddress[] addresses = new WorkerAddress[model.numPopulations()];
            for (int i = 0; i < nodes.size(); i++) {
                NodeId node = nodes.get(i);
                List<Integer> group = groups.get(i);
                List<WorkerAddress> spawned;
                if (node.equals(self)) {
                    localRun = new LocalRun(runId, self, model, group, runnerOptions, tracker,
                        cluster == null ? null : cluster.remoteRouter(runId));
                    if (cluster != null) {
                        cluster.host(localRun, tracker);
                    }
                    spawned = localRun.spawn();
                } else {
                    remoteNodes.add(node);
                    spawned = cluster.spawn(node, runId, options.modelSource(), group);
                }
                for (WorkerAddress address : spawned) {
                    addresses[address.index()] = address;
                }
            }

            Roster roster = new Roster(runId, Arrays.asList(addresses));
            if (localRun != null) {
                localRun.assignRoster(roster);
            }
            for (NodeId node : remoteNodes) {
                cluster.sendRoster(node, roster);
            }
            log.debug("Roster of run {} broadcast to {} populations", runId, roster.size());

            List<PopulationReport> reports = tracker.awaitReports();
            long totalTimeUs = (System.nanoTime() - start) / 1000;
            log.info("Run {} finished in {}ms", runId, totalTimeUs / 1000);
            return new Report(totalTimeUs, reports);
        } catch (RuntimeException | InterruptedException e) {
            log.debug("Aborting run {}", runId);
            if (localRun != null) {
                localRun.cancel();
            }
            for (NodeId node : remoteNodes) {
                cluster.cancel(node, runId);
            }
            throw e;
        } finally {
            if (cluster != null) {
                cluster.release(runId);
            }
        }
    }

    private void validatePlacement(NodeId self, List<NodeId> nodes, RunOptions options) {
        if (nodes.stream().distinct().count() != nodes.size()) {
            throw new ConfigurationException("run nodes must be distinct, got: " + nodes);
        }
        boolean remote = nodes.stream().anyMatch(node -> !node.equals(self));
        if (remote && cluster == null) {
            throw new ConfigurationException("placing populations on other nodes requires a cluster, got nodes: " + nodes);
        }
        if (remote && options.modelSource() == null) {
            throw new ConfigurationException("placing populations on other nodes requires a model source");
        }
    }
}

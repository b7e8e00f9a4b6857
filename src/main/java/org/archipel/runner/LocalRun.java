package org.archipel.runner;

import com.typesafe.config.Config;
import org.archipel.evolution.Lineage;
import org.archipel.evolution.Model;
import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Mailbox;
import org.archipel.migration.Migrants;
import org.archipel.node.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The population workers of one run hosted by this process.
 */
public class LocalRun {

    private static final Logger log = LoggerFactory.getLogger(LocalRun.class);

    private final String runId;
    private final NodeId node;
    private final Model model;
    private final List<Integer> indices;
    private final Config runnerOptions;
    private final IReportSink sink;
    private final LocalMessageRouter router;
    private final Map<Integer, PopulationWorker> workers = new LinkedHashMap<>();

    /**
     * @param runId         The run identifier.
     * @param node          The node this process runs as.
     * @param model         The model of the run.
     * @param indices       The population indices hosted here.
     * @param runnerOptions The {@code archipel.runner} configuration section.
     * @param sink          Receives the reports of the local workers.
     * @param remoteRouter  Delivers migrants to other processes, {@code null} for a local run.
     */
    public LocalRun(String runId, NodeId node, Model model, List<Integer> indices, Config runnerOptions,
                    IReportSink sink, IMessageRouter remoteRouter) {
        this.runId = runId;
        this.node = node;
        this.model = model;
        this.indices = List.copyOf(indices);
        this.runnerOptions = runnerOptions;
        this.sink = sink;
        this.router = new LocalMessageRouter(remoteRouter);
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Creates and starts one worker per hosted population. Each worker initializes its
     * population and then waits for the roster.
     *
     * @return The addresses of the spawned workers.
     */
    public synchronized List<WorkerAddress> spawn() {
        if (!workers.isEmpty()) {
            throw new IllegalStateException("run " + runId + " has already been spawned");
        }
        List<Lineage> lineages = model.populations();
        List<WorkerAddress> addresses = new ArrayList<>(indices.size());
        for (int index : indices) {
            if (index < 0 || index >= lineages.size()) {
                throw new IllegalArgumentException(String.format(
                    "population index %d is out of range, the model has %d populations", index, lineages.size()));
            }
            WorkerAddress address = new WorkerAddress(node, index);
            Mailbox mailbox = new Mailbox(address, runnerOptions);
            router.register(mailbox);
            workers.put(index, new PopulationWorker(address, lineages.get(index), model.objective(), mailbox, router, sink));
            addresses.add(address);
        }
        workers.values().forEach(PopulationWorker::start);
        log.debug("Spawned {} population workers for run {} on {}", workers.size(), runId, node);
        return addresses;
    }

    /**
     * Broadcasts the roster to all local workers.
     */
    public synchronized void assignRoster(Roster roster) {
        for (PopulationWorker worker : workers.values()) {
            worker.assignRoster(roster);
        }
    }

    /**
     * Delivers migrants sent by another process to a local worker.
     *
     * @return {@code false} if no such worker is hosted here or its mailbox is full.
     */
    public boolean deliver(int index, Migrants migrants) {
        PopulationWorker worker = workers.get(index);
        return worker != null && worker.getMailbox().offer(migrants);
    }

    /**
     * Interrupts all workers that are still running.
     */
    public void cancel() {
        List<PopulationWorker> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(workers.values());
        }
        for (PopulationWorker worker : snapshot) {
            worker.stop();
        }
        log.debug("Cancelled run {} on {}", runId, node);
    }
}

package org.archipel.runner;

import org.archipel.evolution.IObjective;
import org.archipel.evolution.Lineage;
import org.archipel.evolution.OperationContext;
import org.archipel.evolution.Population;
import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Mailbox;

import java.util.concurrent.CountDownLatch;

/**
 * Evolves one population: applies the initializer, waits for the roster, then applies the
 * pipeline generation by generation until the population terminates and reports the result.
 *
 * <p>The generation is incremented only after a pass that did not terminate the population,
 * so a population terminated by {@code maxGenerations(n)} ends at generation {@code n}.</p>
 */
public class PopulationWorker extends AbstractWorker {

    private final WorkerAddress address;
    private final Lineage lineage;
    private final IObjective objective;
    private final Mailbox mailbox;
    private final IMessageRouter router;
    private final IReportSink sink;
    private final CountDownLatch rosterLatch = new CountDownLatch(1);
    private volatile Roster roster;

    public PopulationWorker(WorkerAddress address, Lineage lineage, IObjective objective, Mailbox mailbox,
                            IMessageRouter router, IReportSink sink) {
        super("population-" + address.index());
        this.address = address;
        this.lineage = lineage;
        this.objective = objective;
        this.mailbox = mailbox;
        this.router = router;
        this.sink = sink;
    }

    public Mailbox getMailbox() {
        return mailbox;
    }

    /**
     * Hands the roster to the worker, releasing it from the roster barrier.
     *
     * @throws IllegalStateException if a roster was already assigned.
     */
    public synchronized void assignRoster(Roster newRoster) {
        if (roster != null) {
            throw new IllegalStateException(String.format("%s already has a roster for run %s", workerName, roster.runId()));
        }
        roster = newRoster;
        rosterLatch.countDown();
    }

    @Override
    protected void run() throws Exception {
        Population population = lineage.initializer()
            .apply(Population.empty(), new OperationContext(objective, null, address, mailbox, router));
        log.debug("{} initialized {} individuals", workerName, population.size());

        transitionTo(WorkerState.AWAITING_ROSTER);
        rosterLatch.await();
        OperationContext context = new OperationContext(objective, roster, address, mailbox, router);

        transitionTo(WorkerState.RUNNING);
        long start = System.nanoTime();
        while (true) {
            population = lineage.pipeline().apply(population, context);
            if (population.terminated()) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("interrupted at generation " + population.generation());
            }
            population = population.nextGeneration();
        }
        long timeUs = (System.nanoTime() - start) / 1000;

        transitionTo(WorkerState.TERMINATED);
        log.debug("{} terminated at generation {} after {}us", workerName, population.generation(), timeUs);
        sink.reportCompleted(new PopulationReport(address, timeUs, population));
        transitionTo(WorkerState.REPORTED);
    }

    @Override
    protected void onFailure(Throwable cause) {
        sink.reportFailed(address, cause);
    }
}

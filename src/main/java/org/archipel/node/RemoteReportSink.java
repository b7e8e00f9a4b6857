package org.archipel.node;

import org.archipel.runner.IReportSink;
import org.archipel.runner.PopulationReport;
import org.archipel.runner.WorkerAddress;
import org.archipel.runner.WorkerFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards the outcome of locally hosted workers to the node coordinating the run, and
 * releases the run once every hosted worker is done.
 *
 * <p>A report that cannot be delivered within the configured attempts is replaced by a
 * failure of that population, so the coordinator never waits for a report that is lost.</p>
 */
class RemoteReportSink implements IReportSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteReportSink.class);

    private final Cluster cluster;
    private final String runId;
    private final NodeId leader;
    private final AtomicInteger outstanding;
    private final int attempts;
    private final Duration retryGap;

    RemoteReportSink(final Cluster cluster, final String runId, final NodeId leader, final int workers) {
        this.cluster = cluster;
        this.runId = runId;
        this.leader = leader;
        this.outstanding = new AtomicInteger(workers);
        this.attempts = cluster.reportAttempts();
        this.retryGap = cluster.reportRetryGap();
    }

    @Override
    public void reportCompleted(final PopulationReport report) {
        try {
            deliverReport(report);
        } catch (final NodeCommunicationException e) {
            LOGGER.warn("Failed to report population {} of run {} to {} after {} attempts, reporting a failure instead",
                report.worker().index(), runId, leader, attempts);
            sendFailure(report.worker(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Interrupted while reporting population {} of run {}", report.worker().index(), runId);
        } finally {
            done();
        }
    }

    @Override
    public void reportFailed(final WorkerAddress worker, final Throwable cause) {
        try {
            if (cluster.registry().run(runId).isEmpty()) {
                LOGGER.debug("Run {} was cancelled, not reporting {} of worker {}",
                    runId, cause.getClass().getSimpleName(), worker);
                return;
            }
            sendFailure(worker, cause);
        } finally {
            done();
        }
    }

    private void deliverReport(final PopulationReport report) throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                cluster.client().sendReport(leader, runId, report);
                return;
            } catch (final NodeCommunicationException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                LOGGER.debug("Report of population {} of run {} failed (attempt {}/{}): {}",
                    report.worker().index(), runId, attempt, attempts, e.getMessage());
                Thread.sleep(retryGap.toMillis());
            }
        }
    }

    /**
     * Sends a failure to the coordinating node. A cause that cannot be serialized, or that the
     * coordinator rejects, is replaced by its description.
     */
    private void sendFailure(final WorkerAddress worker, final Throwable cause) {
        try {
            cluster.client().sendFailure(leader, runId, new WorkerFailure(worker, cause));
            return;
        } catch (final IllegalArgumentException | NodeCommunicationException e) {
            LOGGER.debug("Failure of population {} of run {} not delivered as is: {}", worker.index(), runId, e.getMessage());
        }
        try {
            cluster.client().sendFailure(leader, runId, new WorkerFailure(worker,
                new IllegalStateException(cause.getClass().getName() + ": " + cause.getMessage())));
        } catch (final NodeCommunicationException e) {
            LOGGER.error("Leader {} of run {} is unreachable, population {} cannot be reported: {}",
                leader, runId, worker.index(), e.getMessage());
            LOGGER.debug("Exception details:", e);
        }
    }

    private void done() {
        if (outstanding.decrementAndGet() == 0) {
            cluster.registry().release(runId);
            LOGGER.debug("All hosted populations of run {} are done", runId);
        }
    }
}

package org.archipel.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects the reports of all populations of a run, from local and remote workers.
 * The first failure ends the wait.
 */
public class RunTracker implements IReportSink {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private record Failure(WorkerAddress worker, Throwable cause) {
    }

    private final String runId;
    private final int expectedReports;
    private final Map<Integer, PopulationReport> reports = new ConcurrentSkipListMap<>();
    private final AtomicReference<Failure> failure = new AtomicReference<>();
    private final CountDownLatch done;

    public RunTracker(String runId, int expectedReports) {
        this.runId = runId;
        this.expectedReports = expectedReports;
        this.done = new CountDownLatch(expectedReports);
    }

    @Override
    public void reportCompleted(PopulationReport report) {
        if (reports.putIfAbsent(report.worker().index(), report) != null) {
            log.warn("Ignoring duplicate report of population {} in run {}", report.worker().index(), runId);
            return;
        }
        done.countDown();
    }

    @Override
    public void reportFailed(WorkerAddress worker, Throwable cause) {
        if (failure.compareAndSet(null, new Failure(worker, cause))) {
            log.debug("Run {} failed at population {}", runId, worker);
            while (done.getCount() > 0) {
                done.countDown();
            }
        }
    }

    /**
     * Blocks until every population reported or one failed.
     *
     * @return The reports ordered by population index.
     * @throws RunFailedException   if a population failed.
     * @throws InterruptedException if interrupted while waiting.
     */
    public List<PopulationReport> awaitReports() throws InterruptedException {
        done.await();
        Failure first = failure.get();
        if (first != null) {
            throw new RunFailedException(runId, first.worker(), first.cause());
        }
        List<PopulationReport> ordered = new ArrayList<>(reports.values());
        if (ordered.size() != expectedReports) {
            throw new IllegalStateException(String.format(
                "run %s expected %d reports but got %d", runId, expectedReports, ordered.size()));
        }
        return ordered;
    }

    public boolean hasFailed() {
        return failure.get() != null;
    }
}

package org.archipel.runner;

/**
 * Thrown by {@link Runner#run} when a population worker fails. The cause is the worker's
 * exception.
 */
public class RunFailedException extends RuntimeException {

    private final String runId;
    private final WorkerAddress worker;

    public RunFailedException(String runId, WorkerAddress worker, Throwable cause) {
        super(String.format("run %s failed, population %s stopped with %s: %s",
            runId, worker, cause.getClass().getSimpleName(), cause.getMessage()), cause);
        this.runId = runId;
        this.worker = worker;
    }

    public String getRunId() {
        return runId;
    }

    public WorkerAddress getWorker() {
        return worker;
    }
}

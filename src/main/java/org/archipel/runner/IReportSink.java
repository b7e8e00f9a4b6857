package org.archipel.runner;

/**
 * Receives the outcome of population workers.
 */
public interface IReportSink {

    void reportCompleted(PopulationReport report);

    void reportFailed(WorkerAddress worker, Throwable cause);
}

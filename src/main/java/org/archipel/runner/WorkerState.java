package org.archipel.runner;

/**
 * Lifecycle of a population worker.
 * <pre>
 * SPAWNED -> AWAITING_ROSTER -> RUNNING -> TERMINATED -> REPORTED
 *                    \______________\____________\______-> FAILED
 * </pre>
 */
public enum WorkerState {
    SPAWNED,
    AWAITING_ROSTER,
    RUNNING,
    TERMINATED,
    REPORTED,
    FAILED
}

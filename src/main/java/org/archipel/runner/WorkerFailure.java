package org.archipel.runner;

import java.io.Serializable;

/**
 * A failed population worker, as sent from a hosting node to the coordinating node.
 *
 * @param worker The failed worker.
 * @param cause  The exception that ended it.
 */
public record WorkerFailure(WorkerAddress worker, Throwable cause) implements Serializable {
}

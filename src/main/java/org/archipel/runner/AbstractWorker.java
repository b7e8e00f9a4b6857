package org.archipel.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for workers running on a dedicated thread, with lifecycle tracking through
 * {@link WorkerState}. Subclasses implement {@link #run()}.
 */
public abstract class AbstractWorker {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String workerName;
    private final AtomicReference<WorkerState> currentState = new AtomicReference<>(WorkerState.SPAWNED);
    private Thread workerThread;

    protected AbstractWorker(String name) {
        this.workerName = name;
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if the worker was already started.
     */
    public final synchronized void start() {
        if (workerThread != null) {
            throw new IllegalStateException(String.format(
                "Cannot start worker '%s' as it is already in state %s", workerName, getCurrentState()));
        }
        workerThread = new Thread(this::runWorker);
        workerThread.setName(workerName);
        workerThread.setDaemon(true);
        workerThread.start();
        log.debug("{} started", workerName);
    }

    /**
     * Interrupts the worker thread and waits briefly for it to finish.
     */
    public final void stop() {
        Thread thread;
        synchronized (this) {
            thread = workerThread;
        }
        if (thread == null || !thread.isAlive()) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for worker thread to stop", workerName);
            return;
        }
        if (thread.isAlive()) {
            log.warn("{} thread did not stop within 5 seconds", workerName);
        }
    }

    public WorkerState getCurrentState() {
        return currentState.get();
    }

    protected void transitionTo(WorkerState state) {
        WorkerState previous = currentState.getAndSet(state);
        log.trace("{} state {} -> {}", workerName, previous, state);
    }

    /**
     * Wraps {@link #run()} with state handling.
     * <ul>
     *   <li>{@link InterruptedException}: the worker was cancelled, logged at DEBUG</li>
     *   <li>any other throwable, errors included: logged once at ERROR (stack trace at DEBUG),
     *       the state becomes {@link WorkerState#FAILED} and {@link #onFailure(Throwable)} is called</li>
     * </ul>
     */
    private void runWorker() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("{} interrupted, shutting down", workerName);
            transitionTo(WorkerState.FAILED);
            onFailure(e);
            Thread.currentThread().interrupt();
        } catch (Throwable e) {
            log.error("{} stopped with ERROR due to {}: {}", workerName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            transitionTo(WorkerState.FAILED);
            onFailure(e);
        } finally {
            log.debug("Worker thread for {} has terminated", workerName);
        }
    }

    /**
     * The main logic of the worker, executed on its dedicated thread.
     * <p>
     * Fatal errors are thrown; this class logs them and marks the worker as failed.
     * Blocking calls must let {@link InterruptedException} propagate.
     *
     * @throws Exception if the worker cannot complete.
     */
    protected abstract void run() throws Exception;

    /**
     * Called on the worker thread after {@link #run()} failed or was interrupted.
     *
     * @param cause The throwable that ended the worker.
     */
    protected abstract void onFailure(Throwable cause);
}

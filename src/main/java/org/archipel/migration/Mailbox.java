package org.archipel.migration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.archipel.runner.WorkerAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The bounded inbox of one population worker, based on {@link ArrayBlockingQueue}.
 *
 * <p>Only the owning worker takes from the mailbox; peers write to it through an
 * {@link IMessageRouter}. Writers never block: a batch arriving at a full mailbox is dropped
 * and logged.</p>
 */
public class Mailbox {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final WorkerAddress owner;
    private final int capacity;
    private final ArrayBlockingQueue<Migrants> queue;
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * Creates a mailbox using the {@code mailbox-capacity} option (default 1024).
     *
     * @param owner   The worker owning the mailbox.
     * @param options The runner configuration.
     * @throws IllegalArgumentException if the capacity is not positive.
     */
    public Mailbox(WorkerAddress owner, Config options) {
        this(owner, readCapacity(owner, options));
    }

    public Mailbox(WorkerAddress owner, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive for worker " + owner + ".");
        }
        this.owner = owner;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    private static int readCapacity(WorkerAddress owner, Config options) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("mailbox-capacity", 1024)));
        try {
            return finalConfig.getInt("mailbox-capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid mailbox configuration for worker " + owner, e);
        }
    }

    public WorkerAddress owner() {
        return owner;
    }

    /**
     * Adds a batch without blocking.
     *
     * @param migrants The batch to deliver.
     * @return {@code true} if the batch was queued, {@code false} if it was dropped.
     */
    public boolean offer(Migrants migrants) {
        if (migrants == null) {
            throw new NullPointerException("migrants cannot be null");
        }
        if (queue.offer(migrants)) {
            received.incrementAndGet();
            return true;
        }
        dropped.incrementAndGet();
        log.warn("Mailbox of worker {} is full ({} batches), dropping migrants from {}",
            owner, capacity, migrants.sender());
        return false;
    }

    /**
     * Takes the oldest batch, waiting up to {@code timeout} for one to arrive.
     *
     * @param timeout The maximum time to wait.
     * @return The batch, or empty if none arrived in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Optional<Migrants> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Takes the oldest batch if one is present.
     */
    public Optional<Migrants> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public int size() {
        return queue.size();
    }

    public Map<String, Number> getMetrics() {
        return Map.of(
            "capacity", capacity,
            "current_size", queue.size(),
            "received", received.get(),
            "dropped", dropped.get()
        );
    }
}

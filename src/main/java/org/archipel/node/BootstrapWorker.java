package org.archipel.node;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker side of the bootstrap handshake: registers as {@code worker}, waits for a leader to
 * initiate it, then serves until the leader goes away.
 *
 * <p>The leader is considered gone after {@code heartbeatFailures} consecutive failed pings.
 * Runs are hosted by the node server in the meantime; this class only keeps the process
 * alive.</p>
 */
public class BootstrapWorker {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootstrapWorker.class);

    /**
     * The name the worker process registers under.
     */
    public static final String WORKER_NAME = "worker";

    /**
     * @param timeout           How long to wait for the leader's initiate message.
     * @param heartbeatInterval The pause between leader pings.
     * @param heartbeatFailures Consecutive failed pings after which the leader counts as gone.
     */
    public record Options(Duration timeout, Duration heartbeatInterval, int heartbeatFailures) {

        public static final Options DEFAULTS = new Options(Duration.ofSeconds(60), Duration.ofSeconds(1), 3);

        public Options {
            if (heartbeatFailures < 1) {
                throw new IllegalArgumentException("heartbeat-failures must be at least 1, got: " + heartbeatFailures);
            }
        }

        /**
         * @param bootstrap The {@code archipel.bootstrap} configuration section.
         */
        public static Options fromConfig(final Config bootstrap) {
            return new Options(bootstrap.getDuration("worker-timeout"),
                bootstrap.getDuration("heartbeat-interval"), bootstrap.getInt("heartbeat-failures"));
        }
    }

    private final NameDirectory directory;
    private final ClusterClient client;
    private final Options options;
    private final CompletableFuture<NodeId> leader = new CompletableFuture<>();

    public BootstrapWorker(final NameDirectory directory, final ClusterClient client, final Options options) {
        this.directory = directory;
        this.client = client;
        this.options = options;
    }

    /**
     * Registers the worker and blocks until the leader terminates.
     *
     * @return The leader this worker served.
     * @throws BootstrapTimeoutException if no leader initiated the worker in time.
     * @throws InterruptedException      if interrupted while waiting.
     */
    public NodeId run() throws InterruptedException {
        final NodeId leaderNode = awaitLeader();
        serveUntilLeaderTerminates(leaderNode);
        return leaderNode;
    }

    /**
     * Registers the worker and waits for the initiate message.
     *
     * @return The leader node.
     */
    public NodeId awaitLeader() throws InterruptedException {
        directory.register(WORKER_NAME, this::onInitiate);
        LOGGER.info("Waiting up to {}s for a leader", options.timeout().toSeconds());
        try {
            final NodeId leaderNode = leader.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            LOGGER.info("Established connection with the leader node ({})", leaderNode);
            return leaderNode;
        } catch (final TimeoutException e) {
            directory.unregister(WORKER_NAME);
            throw new BootstrapTimeoutException(String.format(
                "expected to receive an initial message from the leader node within %dms, but got none",
                options.timeout().toMillis()));
        } catch (final ExecutionException e) {
            throw new IllegalStateException("leader future completed exceptionally", e.getCause());
        }
    }

    /**
     * Pings the leader until it stops answering.
     */
    public void serveUntilLeaderTerminates(final NodeId leaderNode) throws InterruptedException {
        int failures = 0;
        while (failures < options.heartbeatFailures()) {
            Thread.sleep(options.heartbeatInterval().toMillis());
            if (client.ping(leaderNode)) {
                failures = 0;
            } else {
                failures++;
                LOGGER.debug("Leader {} did not answer ({}/{})", leaderNode, failures, options.heartbeatFailures());
            }
        }
        directory.unregister(WORKER_NAME);
        LOGGER.info("Leader node {} terminated", leaderNode);
    }

    private void onInitiate(final NodeId leaderNode) {
        if (!leader.complete(leaderNode)) {
            LOGGER.debug("Ignoring initiate from {}, already serving {}", leaderNode, leader.join());
        }
    }
}

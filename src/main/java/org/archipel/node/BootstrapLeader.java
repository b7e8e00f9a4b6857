package org.archipel.node;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Leader side of the bootstrap handshake: connects to every worker node and initiates the
 * worker process registered there.
 *
 * <p>Each node goes from disconnected (not answering pings) to unconfirmed (reachable, but
 * no {@code worker} registered yet) to initiated. The leader retries in rounds until every
 * node is initiated or the attempts are exhausted.</p>
 */
public class BootstrapLeader {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootstrapLeader.class);

    /**
     * @param maxAttempts The number of connection rounds.
     * @param attemptGap  The pause between rounds.
     */
    public record Options(int maxAttempts, Duration attemptGap) {

        public static final Options DEFAULTS = new Options(60, Duration.ofSeconds(1));

        public Options {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("max-attempts must be at least 1, got: " + maxAttempts);
            }
        }

        /**
         * @param bootstrap The {@code archipel.bootstrap} configuration section.
         */
        public static Options fromConfig(final Config bootstrap) {
            return new Options(bootstrap.getInt("max-attempts"), bootstrap.getDuration("attempt-gap"));
        }
    }

    private final ClusterClient client;
    private final NodeId self;
    private final Options options;

    public BootstrapLeader(final ClusterClient client, final NodeId self, final Options options) {
        this.client = client;
        this.self = self;
        this.options = options;
    }

    /**
     * Connects to and initiates all worker nodes.
     *
     * @param workerNodes The nodes expected to run a worker process.
     * @throws BootstrapTimeoutException if some nodes are still disconnected or unconfirmed
     *                                   after the last round.
     * @throws InterruptedException      if interrupted between rounds.
     */
    public void initiate(final List<NodeId> workerNodes) throws InterruptedException {
        List<NodeId> disconnected = new ArrayList<>(workerNodes);
        List<NodeId> unconfirmed = new ArrayList<>();

        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            final List<NodeId> stillDisconnected = new ArrayList<>();
            for (final NodeId node : disconnected) {
                if (client.ping(node)) {
                    LOGGER.debug("Connected to {}", node);
                    unconfirmed.add(node);
                } else {
                    stillDisconnected.add(node);
                }
            }
            disconnected = stillDisconnected;

            final List<NodeId> stillUnconfirmed = new ArrayList<>();
            for (final NodeId node : unconfirmed) {
                if (client.lookup(node, BootstrapWorker.WORKER_NAME) && client.initiate(node, BootstrapWorker.WORKER_NAME, self)) {
                    LOGGER.debug("Initiated worker on {}", node);
                } else {
                    stillUnconfirmed.add(node);
                }
            }
            unconfirmed = stillUnconfirmed;

            if (disconnected.isEmpty() && unconfirmed.isEmpty()) {
                LOGGER.info("Established connection with all {} worker nodes", workerNodes.size());
                return;
            }
            LOGGER.debug("Bootstrap attempt {}/{}: {} disconnected, {} unconfirmed",
                attempt, options.maxAttempts(), disconnected.size(), unconfirmed.size());
            if (attempt < options.maxAttempts()) {
                Thread.sleep(options.attemptGap().toMillis());
            }
        }

        LOGGER.error("Bootstrap failed: {} disconnected, {} unconfirmed nodes", disconnected.size(), unconfirmed.size());
        throw new BootstrapTimeoutException(disconnected, unconfirmed);
    }
}

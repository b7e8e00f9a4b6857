package org.archipel.migration;

import org.archipel.evolution.ConfigurationException;

import java.time.Duration;

/**
 * Options of {@link MigrationOperations#immigrate}.
 *
 * @param interval Immigrate every {@code interval} generations.
 * @param blocking Wait for migrants if none are queued yet.
 * @param timeout  The longest blocking wait before the run fails.
 */
public record ImmigrationOptions(int interval, boolean blocking, Duration timeout) {

    public static final ImmigrationOptions DEFAULTS = new ImmigrationOptions(1, true, Duration.ofSeconds(20));

    public ImmigrationOptions {
        if (interval < 1) {
            throw new ConfigurationException("immigration interval must be at least 1, got: " + interval);
        }
        if (timeout == null || timeout.isNegative()) {
            throw new ConfigurationException("immigration timeout must not be negative, got: " + timeout);
        }
    }

    public ImmigrationOptions withInterval(int newInterval) {
        return new ImmigrationOptions(newInterval, blocking, timeout);
    }

    public ImmigrationOptions withBlocking(boolean newBlocking) {
        return new ImmigrationOptions(interval, newBlocking, timeout);
    }

    public ImmigrationOptions withTimeout(Duration newTimeout) {
        return new ImmigrationOptions(interval, blocking, newTimeout);
    }
}

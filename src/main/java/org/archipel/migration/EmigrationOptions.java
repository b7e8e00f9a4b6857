package org.archipel.migration;

import org.archipel.evolution.ConfigurationException;

/**
 * Options of {@link MigrationOperations#emigrate}.
 *
 * @param interval Emigrate every {@code interval} generations.
 * @param targets  The number of neighbours to send to.
 */
public record EmigrationOptions(int interval, TargetCount targets) {

    public static final EmigrationOptions DEFAULTS = new EmigrationOptions(1, TargetCount.exactly(1));

    public EmigrationOptions {
        if (interval < 1) {
            throw new ConfigurationException("emigration interval must be at least 1, got: " + interval);
        }
        if (targets == null) {
            throw new ConfigurationException("number of targets must be set");
        }
    }

    public EmigrationOptions withInterval(int newInterval) {
        return new EmigrationOptions(newInterval, targets);
    }

    public EmigrationOptions withTargets(TargetCount newTargets) {
        return new EmigrationOptions(interval, newTargets);
    }
}

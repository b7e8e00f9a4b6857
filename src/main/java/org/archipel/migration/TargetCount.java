package org.archipel.migration;

import org.archipel.evolution.ConfigurationException;

import java.util.Random;

/**
 * The number of neighbours an emigration sends to: a fixed count or an inclusive range drawn
 * from at random on every emigration.
 *
 * @param min The smallest count.
 * @param max The largest count.
 */
public record TargetCount(int min, int max) {

    public TargetCount {
        if (min < 0 || max < min) {
            throw new ConfigurationException(String.format(
                "expected the number of targets to satisfy 0 <= min <= max, got: %d..%d", min, max));
        }
    }

    public static TargetCount exactly(int count) {
        return new TargetCount(count, count);
    }

    public static TargetCount range(int min, int max) {
        return new TargetCount(min, max);
    }

    public int draw(Random random) {
        return min == max ? min : min + random.nextInt(max - min + 1);
    }

    @Override
    public String toString() {
        return min == max ? Integer.toString(min) : min + ".." + max;
    }
}

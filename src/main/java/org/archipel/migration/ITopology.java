package org.archipel.migration;

import java.util.List;

/**
 * A directed communication graph between populations, independent of the number of
 * populations.
 */
@FunctionalInterface
public interface ITopology {

    /**
     * Computes the neighbours of a population.
     *
     * @param numPopulations The number of populations, at least 1.
     * @param selfIndex      The index of the population, in {@code [0, numPopulations)}.
     * @return The indices of the neighbours.
     */
    List<Integer> neighbours(int numPopulations, int selfIndex);
}

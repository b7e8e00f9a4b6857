package org.archipel.evolution;

import java.io.Serializable;
import java.util.List;

/**
 * Capability every genome encoding plugin implements. The engine treats genomes and fitness
 * as opaque batches and delegates the few representation dependent operations it needs to
 * this interface.
 *
 * <p>Implementations must be stateless; they travel with populations between nodes.</p>
 */
public interface IRepresentationSpec extends Serializable {

    /**
     * Returns the number of individuals in the given genome batch.
     *
     * @param genomes The genome batch.
     * @return The number of individuals.
     */
    int populationSize(Object genomes);

    /**
     * Concatenates several genome batches into one, preserving order.
     *
     * @param genomes The genome batches.
     * @return A single batch holding all individuals.
     */
    Object concatenateGenomes(List<Object> genomes);

    /**
     * Concatenates several fitness batches into one. The order of individuals must match
     * {@link #concatenateGenomes(List)}.
     *
     * @param fitness The fitness batches.
     * @return A single fitness batch.
     */
    Object concatenateFitness(List<Object> fitness);
}

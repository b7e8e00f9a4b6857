package org.archipel.evolution;

/**
 * The optimisation objective, evaluated on a whole genome batch at once.
 *
 * <p>The returned fitness batch must have the same cardinality and order as the genomes.
 * Higher values indicate better individuals; the engine always maximises.</p>
 */
@FunctionalInterface
public interface IObjective {

    /**
     * Computes the fitness of every individual in the batch.
     *
     * @param genomes The genome batch.
     * @return The fitness batch.
     */
    Object evaluate(Object genomes);
}

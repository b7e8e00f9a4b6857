package org.archipel.evolution;

/**
 * The definition of one evolving population: how it starts and how it evolves.
 *
 * @param initializer Creates the first generation from the empty population.
 * @param pipeline    Applied once per generation.
 */
public record Lineage(Operation initializer, Pipeline pipeline) {

    public Lineage {
        if (initializer == null || pipeline == null) {
            throw new ConfigurationException("a lineage needs both an initializer and a pipeline");
        }
    }
}

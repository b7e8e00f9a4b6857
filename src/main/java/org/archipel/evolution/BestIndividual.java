package org.archipel.evolution;

import java.io.Serializable;

/**
 * The fittest individual seen by a population, stored in its log under
 * {@link Population#BEST_INDIVIDUAL_LOG_KEY}.
 *
 * @param genome     The genome, in the representation's single-individual form.
 * @param fitness    The fitness of the genome.
 * @param generation The generation the individual was found in.
 */
public record BestIndividual(Object genome, double fitness, int generation) implements Serializable {
}

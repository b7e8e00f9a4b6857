package org.archipel.evolution;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A snapshot of one evolving population at a specific generation.
 *
 * <p>Instances are immutable; every transformation returns a new snapshot. Genomes and fitness
 * are opaque batches interpreted by the {@link IRepresentationSpec} of the population's
 * {@link RepresentationTag}. Fitness is either absent or consistent with the current genomes:
 * replacing the genomes always drops the fitness.</p>
 *
 * <p>The {@code log} holds arbitrary entries written by operations (for example the best
 * individual found so far under {@link #BEST_INDIVIDUAL_LOG_KEY}).</p>
 */
public final class Population implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Log key under which logging operations store a {@link BestIndividual}.
     */
    public static final String BEST_INDIVIDUAL_LOG_KEY = "best_individual";

    private final Object genomes;
    private final Object fitness;
    private final RepresentationTag representation;
    private final int generation;
    private final boolean terminated;
    private final Map<String, Object> log;

    private Population(Object genomes, Object fitness, RepresentationTag representation,
                       int generation, boolean terminated, Map<String, Object> log) {
        if (generation < 1) {
            throw new IllegalArgumentException("generation must be at least 1, got: " + generation);
        }
        this.genomes = genomes;
        this.fitness = fitness;
        this.representation = representation;
        this.generation = generation;
        this.terminated = terminated;
        this.log = log;
    }

    /**
     * Returns the empty population an initializer is applied to: no genomes, no
     * representation, generation 1.
     *
     * @return The empty population.
     */
    public static Population empty() {
        return new Population(null, null, null, 1, false, Collections.emptyMap());
    }

    /**
     * Wraps a genome batch of the given representation into a fresh population.
     *
     * @param genomes        The genome batch.
     * @param representation The representation of the genomes.
     * @return A population at generation 1 without fitness.
     */
    public static Population of(Object genomes, RepresentationTag representation) {
        return new Population(genomes, null, representation, 1, false, Collections.emptyMap());
    }

    public Object genomes() {
        return genomes;
    }

    /**
     * Returns the genomes cast to the type the caller's representation uses.
     *
     * @param type The expected batch type.
     * @param <T>  The batch type.
     * @return The genome batch.
     * @throws IllegalStateException if the genomes are absent or of another type.
     */
    public <T> T genomesAs(Class<T> type) {
        if (!type.isInstance(genomes)) {
            throw new IllegalStateException(String.format("expected genomes of type %s but got %s",
                type.getName(), genomes == null ? "none" : genomes.getClass().getName()));
        }
        return type.cast(genomes);
    }

    public Object fitness() {
        return fitness;
    }

    /**
     * Returns the fitness cast to the type the caller's representation uses.
     *
     * @param type The expected batch type.
     * @param <T>  The batch type.
     * @return The fitness batch.
     * @throws IllegalStateException if the fitness is absent or of another type.
     */
    public <T> T fitnessAs(Class<T> type) {
        if (!type.isInstance(fitness)) {
            throw new IllegalStateException(String.format("expected fitness of type %s but got %s",
                type.getName(), fitness == null ? "none" : fitness.getClass().getName()));
        }
        return type.cast(fitness);
    }

    public boolean hasFitness() {
        return fitness != null;
    }

    public RepresentationTag representation() {
        return representation;
    }

    public int generation() {
        return generation;
    }

    public boolean terminated() {
        return terminated;
    }

    public Map<String, Object> log() {
        return log;
    }

    /**
     * Returns the number of individuals, as reported by the representation spec.
     *
     * @return The population size.
     * @throws IllegalStateException if the population has no representation yet.
     */
    public int size() {
        if (representation == null) {
            throw new IllegalStateException("population has no representation, it has not been initialized");
        }
        return representation.spec().populationSize(genomes);
    }

    /**
     * Replaces the genomes. The fitness is dropped since it no longer matches.
     */
    public Population withGenomes(Object newGenomes) {
        return new Population(newGenomes, null, representation, generation, terminated, log);
    }

    /**
     * Replaces genomes and fitness together, for operations that keep both consistent
     * (selection, for instance).
     */
    public Population withGenomesAndFitness(Object newGenomes, Object newFitness) {
        return new Population(newGenomes, newFitness, representation, generation, terminated, log);
    }

    public Population withFitness(Object newFitness) {
        return new Population(genomes, newFitness, representation, generation, terminated, log);
    }

    public Population withoutFitness() {
        if (fitness == null) {
            return this;
        }
        return new Population(genomes, null, representation, generation, terminated, log);
    }

    public Population withRepresentation(RepresentationTag newRepresentation) {
        return new Population(genomes, fitness, newRepresentation, generation, terminated, log);
    }

    public Population withGeneration(int newGeneration) {
        return new Population(genomes, fitness, representation, newGeneration, terminated, log);
    }

    public Population nextGeneration() {
        return withGeneration(generation + 1);
    }

    public Population terminate() {
        if (terminated) {
            return this;
        }
        return new Population(genomes, fitness, representation, generation, true, log);
    }

    /**
     * Returns a copy with the given log entry added or replaced.
     */
    public Population withLogEntry(String key, Object value) {
        Map<String, Object> newLog = new LinkedHashMap<>(log);
        newLog.put(key, value);
        return new Population(genomes, fitness, representation, generation, terminated,
            Collections.unmodifiableMap(newLog));
    }

    /**
     * Returns {@code k} references to the given snapshot. Since populations are immutable the
     * copies can be transformed independently.
     *
     * @param population The population to duplicate.
     * @param k          The number of copies.
     * @return A list of {@code k} populations.
     */
    public static List<Population> duplicate(Population population, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("number of copies must not be negative, got: " + k);
        }
        return Collections.nCopies(k, population);
    }

    /**
     * Concatenates the individuals of several populations of the same representation.
     *
     * @param populations The populations to concatenate, at least one.
     * @return The joined population.
     * @see #joinWith(List, Function, Function)
     */
    public static Population concatenate(List<Population> populations) {
        if (populations.isEmpty()) {
            throw new IllegalArgumentException("at least one population is required");
        }
        IRepresentationSpec spec = commonRepresentation(populations).spec();
        return joinWith(populations, spec::concatenateGenomes, spec::concatenateFitness);
    }

    /**
     * Joins several populations of the same representation using the given functions.
     * <ul>
     *   <li>the generation is the maximum across the inputs</li>
     *   <li>the result is terminated if any input is terminated</li>
     *   <li>the fitness is absent if any input lacks fitness</li>
     *   <li>the log is the one of the first input</li>
     * </ul>
     *
     * @param populations  The populations to join, at least one.
     * @param genomesJoin  Combines the genome batches.
     * @param fitnessJoin  Combines the fitness batches; only called when all inputs have fitness.
     * @return The joined population.
     * @throws IncompatibleRepresentationException if the inputs have different representations.
     */
    public static Population joinWith(List<Population> populations,
                                      Function<List<Object>, Object> genomesJoin,
                                      Function<List<Object>, Object> fitnessJoin) {
        if (populations.isEmpty()) {
            throw new IllegalArgumentException("at least one population is required");
        }
        RepresentationTag representation = commonRepresentation(populations);

        List<Object> genomes = new ArrayList<>(populations.size());
        List<Object> fitness = new ArrayList<>(populations.size());
        int generation = 1;
        boolean terminated = false;
        boolean allEvaluated = true;
        for (Population population : populations) {
            genomes.add(population.genomes);
            fitness.add(population.fitness);
            generation = Math.max(generation, population.generation);
            terminated |= population.terminated;
            allEvaluated &= population.hasFitness();
        }

        Object joinedFitness = allEvaluated ? fitnessJoin.apply(fitness) : null;
        return new Population(genomesJoin.apply(genomes), joinedFitness, representation, generation,
            terminated, populations.get(0).log);
    }

    private static RepresentationTag commonRepresentation(List<Population> populations) {
        Set<RepresentationTag> representations = new LinkedHashSet<>();
        for (Population population : populations) {
            representations.add(population.representation);
        }
        if (representations.size() != 1) {
            throw new IncompatibleRepresentationException(representations);
        }
        return representations.iterator().next();
    }

    @Override
    public String toString() {
        return String.format("Population[representation=%s, generation=%d, terminated=%b, evaluated=%b]",
            representation, generation, terminated, hasFitness());
    }
}

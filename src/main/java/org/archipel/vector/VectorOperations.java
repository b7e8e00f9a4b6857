package org.archipel.vector;

import org.archipel.evolution.BestIndividual;
import org.archipel.evolution.ConfigurationException;
import org.archipel.evolution.Operation;
import org.archipel.evolution.Population;
import org.archipel.evolution.RepresentationTag;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

/**
 * Operations on {@link VectorRepresentation} populations. Crossovers pair consecutive
 * individuals (0 with 1, 2 with 3, ...); with an odd population the last one is copied.
 */
public final class VectorOperations {

    private VectorOperations() {
    }

    /**
     * Creates {@code n} real vectors of {@code length} genes drawn uniformly from {@code [min, max)}.
     */
    public static Operation initRealRandomUniform(int n, int length, double min, double max) {
        requirePositive("n", n);
        requirePositive("length", length);
        if (!(min < max)) {
            throw new ConfigurationException(String.format("expected min < max, got: %s, %s", min, max));
        }
        return Operation.builder("Initialization: real random uniform")
            .invalidatesFitness(true)
            .outRepresentation(VectorRepresentation.REAL)
            .impl((population, context) -> {
                Random random = random();
                double[][] genomes = new double[n][length];
                for (double[] genome : genomes) {
                    for (int j = 0; j < length; j++) {
                        genome[j] = min + random.nextDouble() * (max - min);
                    }
                }
                return population.withGenomes(genomes);
            })
            .build();
    }

    /**
     * Creates {@code n} random bit strings of {@code length} bits.
     */
    public static Operation initBinaryRandomUniform(int n, int length) {
        requirePositive("n", n);
        requirePositive("length", length);
        return Operation.builder("Initialization: binary random uniform")
            .invalidatesFitness(true)
            .outRepresentation(VectorRepresentation.BINARY)
            .impl((population, context) -> {
                Random random = random();
                double[][] genomes = new double[n][length];
                for (double[] genome : genomes) {
                    for (int j = 0; j < length; j++) {
                        genome[j] = random.nextBoolean() ? 1.0 : 0.0;
                    }
                }
                return population.withGenomes(genomes);
            })
            .build();
    }

    /**
     * Selects {@code n} individuals, each the fitter of two drawn at random.
     */
    public static Operation selectionTournament(int n) {
        requireNonNegative("n", n);
        return selection("Selection: tournament", (genomes, fitness) -> {
            Random random = random();
            int[] winners = new int[n];
            for (int i = 0; i < n; i++) {
                int first = random.nextInt(genomes.length);
                int second = random.nextInt(genomes.length);
                winners[i] = fitness[first] > fitness[second] ? first : second;
            }
            return winners;
        });
    }

    /**
     * Selects the {@code n} fittest individuals.
     */
    public static Operation selectionNatural(int n) {
        requireNonNegative("n", n);
        return selection("Selection: natural", (genomes, fitness) -> {
            if (n > genomes.length) {
                throw new IllegalStateException(String.format(
                    "cannot select %d individuals from a population of %d", n, genomes.length));
            }
            return IntStream.range(0, genomes.length).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> fitness[i]).reversed())
                .limit(n)
                .mapToInt(Integer::intValue)
                .toArray();
        });
    }

    /**
     * Swaps every gene between the two parents with the given probability.
     */
    public static Operation crossoverUniform(double probability) {
        requireProbability(probability);
        return crossover("Crossover: uniform", (parent1, parent2, random) -> {
            for (int j = 0; j < parent1.length; j++) {
                if (random.nextDouble() < probability) {
                    double gene = parent1[j];
                    parent1[j] = parent2[j];
                    parent2[j] = gene;
                }
            }
        });
    }

    /**
     * Cuts the parents at {@code points} distinct random positions and swaps every other
     * segment.
     *
     * @throws ConfigurationException if {@code points < 1}.
     */
    public static Operation crossoverMultiPoint(int points) {
        if (points < 1) {
            throw new ConfigurationException("expected the number of crossover points to be positive, got: " + points);
        }
        return crossover("Crossover: multi point", (parent1, parent2, random) -> {
            int length = parent1.length;
            if (points >= length) {
                throw new IllegalStateException(String.format(
                    "cannot cut genomes of length %d at %d points", length, points));
            }
            boolean[] cut = new boolean[length];
            int chosen = 0;
            while (chosen < points) {
                int position = 1 + random.nextInt(length - 1);
                if (!cut[position]) {
                    cut[position] = true;
                    chosen++;
                }
            }
            boolean swap = false;
            for (int j = 0; j < length; j++) {
                if (cut[j]) {
                    swap = !swap;
                }
                if (swap) {
                    double gene = parent1[j];
                    parent1[j] = parent2[j];
                    parent2[j] = gene;
                }
            }
        });
    }

    /**
     * Flips every bit with the given probability.
     */
    public static Operation mutationBitFlip(double probability) {
        requireProbability(probability);
        return mutation("Mutation: bit flip", VectorRepresentation.BINARY, (genome, random) -> {
            for (int j = 0; j < genome.length; j++) {
                if (random.nextDouble() < probability) {
                    genome[j] = 1.0 - genome[j];
                }
            }
        });
    }

    /**
     * Adds Gaussian noise with standard deviation {@code sigma} to every gene with the given
     * probability.
     */
    public static Operation mutationShiftGaussian(double probability, double sigma) {
        requireProbability(probability);
        if (!(sigma > 0)) {
            throw new ConfigurationException("expected sigma to be positive, got: " + sigma);
        }
        return mutation("Mutation: shift Gaussian", VectorRepresentation.REAL, (genome, random) -> {
            for (int j = 0; j < genome.length; j++) {
                if (random.nextDouble() < probability) {
                    genome[j] += random.nextGaussian() * sigma;
                }
            }
        });
    }

    /**
     * Keeps the fittest individual seen so far in the population log under
     * {@link Population#BEST_INDIVIDUAL_LOG_KEY}.
     */
    public static Operation logBestIndividual() {
        return Operation.builder("Log: best individual")
            .requiresFitness(true)
            .inRepresentations(VectorRepresentation.REAL, VectorRepresentation.BINARY)
            .impl((population, context) -> {
                double[][] genomes = VectorRepresentation.asGenomes(population.genomes());
                double[] fitness = VectorRepresentation.asFitness(population.fitness());
                if (genomes.length == 0) {
                    return population;
                }
                int best = 0;
                for (int i = 1; i < fitness.length; i++) {
                    if (fitness[i] > fitness[best]) {
                        best = i;
                    }
                }
                BestIndividual candidate = new BestIndividual(genomes[best].clone(), fitness[best], population.generation());
                Object current = population.log().get(Population.BEST_INDIVIDUAL_LOG_KEY);
                if (current instanceof BestIndividual previous && previous.fitness() >= candidate.fitness()) {
                    return population;
                }
                return population.withLogEntry(Population.BEST_INDIVIDUAL_LOG_KEY, candidate);
            })
            .build();
    }

    @FunctionalInterface
    private interface Selector {
        int[] select(double[][] genomes, double[] fitness);
    }

    @FunctionalInterface
    private interface PairCrossover {
        void cross(double[] parent1, double[] parent2, Random random);
    }

    @FunctionalInterface
    private interface GeneMutation {
        void mutate(double[] genome, Random random);
    }

    private static Operation selection(String name, Selector selector) {
        return Operation.builder(name)
            .requiresFitness(true)
            .inRepresentations(VectorRepresentation.REAL, VectorRepresentation.BINARY)
            .impl((population, context) -> {
                double[][] genomes = VectorRepresentation.asGenomes(population.genomes());
                double[] fitness = VectorRepresentation.asFitness(population.fitness());
                int[] selected = genomes.length == 0 ? new int[0] : selector.select(genomes, fitness);
                double[][] newGenomes = new double[selected.length][];
                double[] newFitness = new double[selected.length];
                for (int i = 0; i < selected.length; i++) {
                    newGenomes[i] = genomes[selected[i]].clone();
                    newFitness[i] = fitness[selected[i]];
                }
                return population.withGenomesAndFitness(newGenomes, newFitness);
            })
            .build();
    }

    private static Operation crossover(String name, PairCrossover crossover) {
        return Operation.builder(name)
            .invalidatesFitness(true)
            .inRepresentations(VectorRepresentation.REAL, VectorRepresentation.BINARY)
            .impl((population, context) -> {
                double[][] offspring = copy(VectorRepresentation.asGenomes(population.genomes()));
                Random random = random();
                for (int i = 0; i + 1 < offspring.length; i += 2) {
                    crossover.cross(offspring[i], offspring[i + 1], random);
                }
                return population.withGenomes(offspring);
            })
            .build();
    }

    private static Operation mutation(String name, RepresentationTag representation,
                                      GeneMutation mutation) {
        return Operation.builder(name)
            .invalidatesFitness(true)
            .inRepresentations(representation)
            .impl((population, context) -> {
                double[][] mutated = copy(VectorRepresentation.asGenomes(population.genomes()));
                Random random = random();
                for (double[] genome : mutated) {
                    mutation.mutate(genome, random);
                }
                return population.withGenomes(mutated);
            })
            .build();
    }

    private static double[][] copy(double[][] genomes) {
        return Arrays.stream(genomes).map(double[]::clone).toArray(double[][]::new);
    }

    private static Random random() {
        return ThreadLocalRandom.current();
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new ConfigurationException(String.format("expected %s to be positive, got: %d", name, value));
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new ConfigurationException(String.format("expected %s not to be negative, got: %d", name, value));
        }
    }

    private static void requireProbability(double probability) {
        if (probability < 0 || probability > 1) {
            throw new ConfigurationException("expected a probability in [0, 1], got: " + probability);
        }
    }
}

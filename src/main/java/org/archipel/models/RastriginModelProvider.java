package org.archipel.models;

import com.typesafe.config.Config;
import org.archipel.evolution.IObjective;
import org.archipel.evolution.Model;
import org.archipel.evolution.Operations;
import org.archipel.evolution.Pipeline;
import org.archipel.migration.MigrationOperations;
import org.archipel.node.IModelProvider;
import org.archipel.vector.VectorOperations;

/**
 * The Rastrigin function on real vectors in {@code [-5.12, 5.12]}, negated so that the
 * optimum (all zeros) has the highest fitness, 0.
 * Options: those of {@link IslandOptions} plus {@code dimensions} (default 100) and
 * {@code sigma} (default 0.5).
 */
public class RastriginModelProvider implements IModelProvider {

    private static final double BOUND = 5.12;

    static final IObjective RASTRIGIN = genomes -> {
        double[][] rows = (double[][]) genomes;
        double[] fitness = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double sum = 10.0 * rows[i].length;
            for (double x : rows[i]) {
                sum += x * x - 10.0 * Math.cos(2 * Math.PI * x);
            }
            fitness[i] = -sum;
        }
        return fitness;
    };

    @Override
    public Model createModel(Config options) {
        IslandOptions islands = IslandOptions.fromConfig(options);
        int dimensions = options.hasPath("dimensions") ? options.getInt("dimensions") : 100;
        double sigma = options.hasPath("sigma") ? options.getDouble("sigma") : 0.5;

        Pipeline pipeline = Pipeline.of(
            VectorOperations.selectionTournament(islands.populationSize()),
            VectorOperations.crossoverMultiPoint(Math.max(1, Math.min(3, dimensions - 1))),
            VectorOperations.mutationShiftGaussian(0.001, sigma),
            MigrationOperations.emigrate(VectorOperations.selectionTournament(islands.emigrants()),
                islands.topology(), islands.emigration()),
            MigrationOperations.immigrate(VectorOperations::selectionNatural, islands.immigration()),
            VectorOperations.logBestIndividual(),
            Operations.maxGenerations(islands.generations()));

        return Model.builder(RASTRIGIN)
            .addPopulation(VectorOperations.initRealRandomUniform(islands.populationSize(), dimensions, -BOUND, BOUND),
                pipeline, islands.populations())
            .build();
    }
}

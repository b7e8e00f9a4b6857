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
 * One-max on bit strings: the fitness of a genome is its number of ones.
 * Options: those of {@link IslandOptions} plus {@code genome-length} (default 100).
 */
public class OneMaxModelProvider implements IModelProvider {

    static final IObjective ONE_MAX = genomes -> {
        double[][] rows = (double[][]) genomes;
        double[] fitness = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double sum = 0;
            for (double gene : rows[i]) {
                sum += gene;
            }
            fitness[i] = sum;
        }
        return fitness;
    };

    @Override
    public Model createModel(Config options) {
        IslandOptions islands = IslandOptions.fromConfig(options);
        int genomeLength = options.hasPath("genome-length") ? options.getInt("genome-length") : 100;

        Pipeline pipeline = Pipeline.of(
            VectorOperations.selectionTournament(islands.populationSize()),
            VectorOperations.crossoverUniform(0.5),
            VectorOperations.mutationBitFlip(1.0 / genomeLength),
            MigrationOperations.emigrate(VectorOperations.selectionTournament(islands.emigrants()),
                islands.topology(), islands.emigration()),
            MigrationOperations.immigrate(VectorOperations::selectionNatural, islands.immigration()),
            VectorOperations.logBestIndividual(),
            Operations.maxGenerations(islands.generations()));

        return Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(islands.populationSize(), genomeLength),
                pipeline, islands.populations())
            .build();
    }
}

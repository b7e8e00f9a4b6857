package org.archipel.runner;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.archipel.evolution.BestIndividual;
import org.archipel.evolution.ConfigurationException;
import org.archipel.evolution.IObjective;
import org.archipel.evolution.Model;
import org.archipel.evolution.Operation;
import org.archipel.evolution.Operations;
import org.archipel.evolution.Pipeline;
import org.archipel.junit.extensions.logging.ExpectLog;
import org.archipel.junit.extensions.logging.LogLevel;
import org.archipel.junit.extensions.logging.LogWatchExtension;
import org.archipel.migration.ImmigrationOptions;
import org.archipel.migration.MigrationOperations;
import org.archipel.migration.MigrationTimeoutException;
import org.archipel.migration.Topologies;
import org.archipel.node.NodeId;
import org.archipel.vector.VectorOperations;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class RunnerTest {

    private static final Config RUNNER_OPTIONS = ConfigFactory.parseMap(Map.of("mailbox-capacity", 16));

    private static final IObjective ONE_MAX = genomes -> Arrays.stream((double[][]) genomes)
        .mapToDouble(genome -> Arrays.stream(genome).sum())
        .toArray();

    private final Runner runner = new Runner(RUNNER_OPTIONS);

    @Test
    void run_singlePopulationStopsAtMaxGenerations() throws Exception {
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(10, 8), Pipeline.of(
                VectorOperations.selectionTournament(10),
                VectorOperations.mutationBitFlip(0.1),
                Operations.maxGenerations(5)))
            .build();

        Report report = runner.run(model);

        assertThat(report.populationReports()).hasSize(1);
        PopulationReport populationReport = report.populationReports().get(0);
        assertThat(populationReport.population().generation()).isEqualTo(5);
        assertThat(populationReport.population().terminated()).isTrue();
        assertThat(populationReport.population().size()).isEqualTo(10);
        assertThat(populationReport.worker().index()).isZero();
        assertThat(report.totalTimeUs()).isGreaterThanOrEqualTo(populationReport.timeUs());
    }

    @Test
    void run_islandsExchangeMigrantsOnRing() throws Exception {
        List<Integer> keptSizes = Collections.synchronizedList(new ArrayList<>());
        Pipeline pipeline = Pipeline.of(
            VectorOperations.selectionTournament(20),
            VectorOperations.crossoverUniform(0.5),
            VectorOperations.mutationBitFlip(0.05),
            MigrationOperations.emigrate(VectorOperations.selectionTournament(3), Topologies.RING),
            MigrationOperations.immigrate(keep -> {
                keptSizes.add(keep);
                return VectorOperations.selectionNatural(keep);
            }),
            VectorOperations.logBestIndividual(),
            Operations.maxGenerations(10));
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(20, 16), pipeline, 2)
            .build();

        Report report = runner.run(model);

        assertThat(report.populationReports()).hasSize(2);
        assertThat(report.populationReports()).extracting(r -> r.worker().index()).containsExactly(0, 1);
        for (PopulationReport populationReport : report.populationReports()) {
            assertThat(populationReport.population().generation()).isEqualTo(10);
            assertThat(populationReport.population().size()).isEqualTo(20);
        }
        // every generation of both islands receives one batch of 3 emigrants
        assertThat(keptSizes).hasSize(20).containsOnly(17);
        BestIndividual best = report.bestIndividual().orElseThrow();
        assertThat(best.fitness()).isBetween(0.0, 16.0);
        assertThat(report.formatSummary()).contains("Populations: 2", "Generations (mean): 10", "Best individual");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "population-\\d stopped with ERROR due to MigrationTimeoutException.*")
    void run_failsWhenImmigrationTimesOut() {
        Operation immigrate = MigrationOperations.immigrate(VectorOperations::selectionNatural,
            ImmigrationOptions.DEFAULTS.withTimeout(Duration.ofMillis(100)));
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(4, 4), Pipeline.of(immigrate, Operations.maxGenerations(3)), 2)
            .build();

        assertThatThrownBy(() -> runner.run(model))
            .isInstanceOf(RunFailedException.class)
            .hasCauseInstanceOf(MigrationTimeoutException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "population-0 stopped with ERROR due to AssertionError: broken operator")
    void run_failsWhenAnOperationThrowsAnError() {
        Operation broken = Operation.builder("broken")
            .impl((population, context) -> {
                throw new AssertionError("broken operator");
            })
            .build();
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(4, 4), Pipeline.of(broken, Operations.maxGenerations(3)))
            .build();

        assertThatThrownBy(() -> runner.run(model))
            .isInstanceOf(RunFailedException.class)
            .hasCauseInstanceOf(AssertionError.class)
            .hasMessageContaining("AssertionError: broken operator");
    }

    @Test
    void run_rejectsRemoteNodesWithoutCluster() {
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(4, 4), Pipeline.of(Operations.maxGenerations(1)), 2)
            .build();
        RunOptions options = RunOptions.distributed(List.of(new NodeId("a", "localhost", 1), new NodeId("b", "localhost", 2)), null);

        assertThatThrownBy(() -> runner.run(model, options))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("requires a cluster");
    }

    @Test
    void run_rejectsGroupsNotCoveringAllPopulations() {
        Model model = Model.builder(ONE_MAX)
            .addPopulation(VectorOperations.initBinaryRandomUniform(4, 4), Pipeline.of(Operations.maxGenerations(1)), 3)
            .build();

        assertThatThrownBy(() -> runner.run(model, RunOptions.local().withPopulationGroups(List.of(List.of(0, 1)))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("exactly once");
    }
}

package org.archipel.evolution;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.archipel.evolution.IntListRepresentation.IDENTITY;
import static org.archipel.evolution.IntListRepresentation.INTS;
import static org.archipel.evolution.IntListRepresentation.OTHER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class OperationsTest {

    private final OperationContext context = OperationContext.standalone(IDENTITY);

    @Test
    void maxGenerations_terminatesAtLimit() throws Exception {
        Operation limit = Operations.maxGenerations(3);
        Population population = Population.of(List.of(1), INTS);

        assertThat(limit.apply(population.withGeneration(2), context).terminated()).isFalse();
        assertThat(limit.apply(population.withGeneration(3), context).terminated()).isTrue();
        assertThatThrownBy(() -> Operations.maxGenerations(0)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void splitJoin_runsEachPartThroughItsPipeline() throws Exception {
        Operation negate = Operation.builder("negate")
            .invalidatesFitness(true)
            .impl((population, ctx) -> population.withGenomes(
                ((List<?>) population.genomes()).stream().map(v -> -(Integer) v).toList()))
            .build();
        Operation flow = Operations.splitJoin(
            population -> {
                List<?> genomes = (List<?>) population.genomes();
                return List.of(population.withGenomes(genomes.subList(0, 1)), population.withGenomes(genomes.subList(1, genomes.size())));
            },
            List.of(Pipeline.of(negate), Pipeline.of()),
            Population::concatenate);

        Population result = flow.apply(Population.of(List.of(1, 2, 3), INTS), context);

        assertThat(result.genomes()).isEqualTo(List.of(-1, 2, 3));
    }

    @Test
    void splitJoin_derivesRepresentationsFromBranches() {
        Operation selection = Operation.builder("select").requiresFitness(true).inRepresentations(INTS, OTHER)
            .impl((p, c) -> p).build();
        Operation intsOnly = Operation.builder("ints").inRepresentations(INTS).impl((p, c) -> p).build();
        Operation toOther = Operation.builder("to other").outRepresentation(OTHER).impl((p, c) -> p).build();

        Operation flow = Operations.splitJoin(p -> List.of(p, p),
            List.of(Pipeline.of(selection, toOther), Pipeline.of(intsOnly)), Population::concatenate);

        assertThat(flow.name()).isEqualTo("Flow: split join");
        assertThat(flow.requiresFitness()).isTrue();
        assertThat(flow.inRepresentations()).containsExactly(INTS);
        assertThat(flow.outRepresentation()).isEqualTo(OTHER);
    }

    @Test
    void splitJoin_rejectsConflictingOutputs() {
        Operation toInts = Operation.builder("to ints").outRepresentation(INTS).impl((p, c) -> p).build();
        Operation toOther = Operation.builder("to other").outRepresentation(OTHER).impl((p, c) -> p).build();

        assertThatThrownBy(() -> Operations.splitJoin(p -> List.of(p, p),
            List.of(Pipeline.of(toInts), Pipeline.of(toOther)), Population::concatenate))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("pipelines must have the same output representation, but got: ");
    }

    @Test
    void ifElse_choosesBranchByPredicate() throws Exception {
        Operation mark = Operation.builder("mark").impl((p, c) -> p.withLogEntry("branch", "true")).build();
        Operation flow = Operations.ifElse(p -> p.generation() > 1, Pipeline.of(mark), Pipeline.of());
        Population population = Population.of(List.of(1), INTS);

        assertThat(flow.apply(population, context).log()).doesNotContainKey("branch");
        assertThat(flow.apply(population.withGeneration(2), context).log()).containsEntry("branch", "true");
    }
}

package org.archipel.evolution;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.archipel.evolution.IntListRepresentation.INTS;
import static org.archipel.evolution.IntListRepresentation.OTHER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PopulationTest {

    @Test
    void empty_startsAtGenerationOneWithoutRepresentation() {
        Population empty = Population.empty();

        assertThat(empty.generation()).isEqualTo(1);
        assertThat(empty.representation()).isNull();
        assertThat(empty.terminated()).isFalse();
        assertThat(empty.hasFitness()).isFalse();
        assertThatThrownBy(empty::size).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void withGenomes_dropsFitness() {
        Population evaluated = Population.of(List.of(1, 2), INTS).withFitness(List.of(1.0, 2.0));

        Population replaced = evaluated.withGenomes(List.of(3));

        assertThat(evaluated.hasFitness()).isTrue();
        assertThat(replaced.hasFitness()).isFalse();
        assertThat(replaced.size()).isEqualTo(1);
    }

    @Test
    void terminate_isIdempotent() {
        Population terminated = Population.of(List.of(1), INTS).terminate();

        assertThat(terminated.terminated()).isTrue();
        assertThat(terminated.terminate()).isSameAs(terminated);
    }

    @Test
    void withLogEntry_doesNotModifyOriginal() {
        Population original = Population.of(List.of(1), INTS);

        Population logged = original.withLogEntry("key", "value");

        assertThat(original.log()).isEmpty();
        assertThat(logged.log()).containsEntry("key", "value");
    }

    @Test
    void duplicate_returnsRequestedNumberOfCopies() {
        Population population = Population.of(List.of(1, 2), INTS);

        assertThat(Population.duplicate(population, 3)).hasSize(3).containsOnly(population);
        assertThat(Population.duplicate(population, 0)).isEmpty();
    }

    @Test
    void concatenate_combinesGenomesAndTakesMaxGeneration() {
        Population first = Population.of(List.of(1, 2), INTS).withFitness(List.of(1.0, 2.0))
            .withLogEntry("origin", "first");
        Population second = Population.of(List.of(3), INTS).withFitness(List.of(3.0)).withGeneration(4);

        Population joined = Population.concatenate(List.of(first, second));

        assertThat(joined.genomes()).isEqualTo(List.of(1, 2, 3));
        assertThat(joined.fitness()).isEqualTo(List.of(1.0, 2.0, 3.0));
        assertThat(joined.generation()).isEqualTo(4);
        assertThat(joined.terminated()).isFalse();
        assertThat(joined.log()).containsEntry("origin", "first");
    }

    @Test
    void concatenate_dropsFitnessIfAnyInputLacksIt() {
        Population evaluated = Population.of(List.of(1), INTS).withFitness(List.of(1.0));
        Population raw = Population.of(List.of(2), INTS).terminate();

        Population joined = Population.concatenate(List.of(evaluated, raw));

        assertThat(joined.hasFitness()).isFalse();
        assertThat(joined.terminated()).isTrue();
    }

    @Test
    void concatenate_rejectsDifferentRepresentations() {
        Population ints = Population.of(List.of(1), INTS);
        Population other = Population.of(List.of(2), OTHER);

        assertThatThrownBy(() -> Population.concatenate(List.of(ints, other)))
            .isInstanceOf(IncompatibleRepresentationException.class)
            .hasMessageContaining("different representations");
    }

    @Test
    void genomesAs_rejectsWrongType() {
        Population population = Population.of(List.of(1), INTS);

        assertThat(population.genomesAs(List.class)).hasSize(1);
        assertThatThrownBy(() -> population.genomesAs(double[][].class))
            .isInstanceOf(IllegalStateException.class);
    }
}

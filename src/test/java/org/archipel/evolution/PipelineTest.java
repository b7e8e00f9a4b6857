package org.archipel.evolution;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.archipel.evolution.IntListRepresentation.IDENTITY;
import static org.archipel.evolution.IntListRepresentation.INTS;
import static org.archipel.evolution.IntListRepresentation.OTHER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PipelineTest {

    private final AtomicInteger evaluations = new AtomicInteger();
    private final OperationContext context = OperationContext.standalone(genomes -> {
        evaluations.incrementAndGet();
        return IDENTITY.evaluate(genomes);
    });

    private static Operation requiring(String name) {
        return Operation.builder(name).requiresFitness(true).impl((population, ctx) -> population).build();
    }

    private static Operation invalidating(String name) {
        return Operation.builder(name)
            .invalidatesFitness(true)
            .impl((population, ctx) -> {
                List<Integer> incremented = new ArrayList<>();
                for (Object value : (List<?>) population.genomes()) {
                    incremented.add((Integer) value + 1);
                }
                return population.withGenomes(incremented);
            })
            .build();
    }

    @Test
    void apply_evaluatesFitnessOnlyWhenRequired() throws Exception {
        Pipeline pipeline = Pipeline.of(IntListRepresentation.identity("a"), IntListRepresentation.identity("b"));

        Population result = pipeline.apply(Population.of(List.of(1, 2), INTS), context);

        assertThat(evaluations).hasValue(0);
        assertThat(result.hasFitness()).isFalse();
    }

    @Test
    void apply_reusesFitnessUntilInvalidated() throws Exception {
        Pipeline pipeline = Pipeline.of(requiring("select"), requiring("log"), invalidating("mutate"), requiring("log again"));

        Population result = pipeline.apply(Population.of(List.of(1, 2), INTS), context);

        assertThat(evaluations).hasValue(2);
        assertThat(result.genomes()).isEqualTo(List.of(2, 3));
        assertThat(result.fitness()).isEqualTo(List.of(2.0, 3.0));
    }

    @Test
    void apply_clearsFitnessAfterInvalidatingOperation() throws Exception {
        Pipeline pipeline = Pipeline.of(requiring("select"), invalidating("mutate"));

        Population result = pipeline.apply(Population.of(List.of(1), INTS), context);

        assertThat(result.hasFitness()).isFalse();
    }

    @Test
    void apply_stopsAtTerminatedPopulation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Operation counting = Operation.builder("count").impl((population, ctx) -> {
            calls.incrementAndGet();
            return population;
        }).build();
        Operation terminate = Operation.builder("terminate").impl((population, ctx) -> population.terminate()).build();
        Population start = Population.of(List.of(1), INTS);

        Population result = Pipeline.of(counting, terminate, counting).apply(start, context);
        Population again = Pipeline.of(counting).apply(result, context);

        assertThat(calls).hasValue(1);
        assertThat(result.terminated()).isTrue();
        assertThat(again).isSameAs(result);
    }

    @Test
    void validate_acceptsMatchingRepresentations() {
        Operation ints = Operation.builder("ints only").inRepresentations(INTS).impl((p, c) -> p).build();

        assertThatCode(() -> Pipeline.of(ints, IntListRepresentation.identity("any")).validate(INTS))
            .doesNotThrowAnyException();
        assertThatCode(() -> Pipeline.of().validate(INTS)).doesNotThrowAnyException();
    }

    @Test
    void validate_reportsFirstRejectingOperation() {
        Operation otherOnly = Operation.builder("other only").inRepresentations(OTHER).impl((p, c) -> p).build();

        assertThatThrownBy(() -> Pipeline.of(IntListRepresentation.identity("any"), otherOnly).validate(INTS))
            .isInstanceOf(RepresentationMismatchException.class)
            .hasMessage("representation mismatch, \"other only\" does not accept IntListRepresentation:ints")
            .satisfies(e -> assertThat(((RepresentationMismatchException) e).getOperationName()).isEqualTo("other only"));
    }

    @Test
    void validate_checksFirstOperationAgainstPipelineOutput() {
        Operation intsOnly = Operation.builder("ints only").inRepresentations(INTS).impl((p, c) -> p).build();
        Operation toOther = Operation.builder("to other").outRepresentation(OTHER).impl((p, c) -> p).build();
        Pipeline pipeline = Pipeline.of(intsOnly, toOther);

        assertThat(pipeline.validateSequence(INTS)).isEqualTo(OTHER);
        assertThatThrownBy(() -> pipeline.validate(INTS))
            .isInstanceOf(RepresentationMismatchException.class)
            .hasMessageContaining("\"ints only\" does not accept IntListRepresentation:other");
    }
}

package org.archipel.evolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of operations applied to a population once per generation.
 *
 * <p>Fitness is computed lazily: the objective runs only right before an operation that
 * requires fitness, and only if the population has none. Operations that invalidate fitness
 * clear it afterwards. A terminated population passes through unchanged.</p>
 */
public final class Pipeline {

    private final List<Operation> operations;

    private Pipeline(List<Operation> operations) {
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public static Pipeline of(Operation... operations) {
        return new Pipeline(List.of(operations));
    }

    public static Pipeline of(List<Operation> operations) {
        return new Pipeline(operations);
    }

    public List<Operation> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Runs the population through all operations.
     *
     * @param population The input population.
     * @param context    The ambient data of the applying worker.
     * @return The resulting population.
     * @throws InterruptedException if an operation is interrupted while blocking.
     */
    public Population apply(Population population, OperationContext context) throws InterruptedException {
        Population current = population;
        for (Operation operation : operations) {
            if (current.terminated()) {
                return current;
            }
            if (operation.requiresFitness() && !current.hasFitness()) {
                current = current.withFitness(context.objective().evaluate(current.genomes()));
            }
            current = operation.apply(current, context);
            if (operation.invalidatesFitness()) {
                current = current.withoutFitness();
            }
        }
        return current;
    }

    /**
     * Checks that every operation accepts the representation produced before it, starting
     * from {@code start}.
     *
     * <p>The first operation is checked once more against the output of the last one, since
     * the pipeline is re-applied every generation.</p>
     *
     * @param start The representation of the populations entering the pipeline.
     * @throws RepresentationMismatchException on the first operation that rejects its input.
     */
    public void validate(RepresentationTag start) {
        if (operations.isEmpty()) {
            return;
        }
        RepresentationTag current = validateSequence(start);
        check(operations.get(0), current);
    }

    /**
     * Checks the operations in order without the wrap-around check and returns the
     * representation the pipeline produces.
     */
    RepresentationTag validateSequence(RepresentationTag start) {
        RepresentationTag current = start;
        for (Operation operation : operations) {
            check(operation, current);
            if (operation.hasOutRepresentation()) {
                current = operation.outRepresentation();
            }
        }
        return current;
    }

    private static void check(Operation operation, RepresentationTag representation) {
        if (!operation.accepts(representation)) {
            throw new RepresentationMismatchException(operation.name(), representation);
        }
    }

    @Override
    public String toString() {
        return "Pipeline" + operations;
    }
}

package org.archipel.evolution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Representation-independent operations: termination and flow control.
 */
public final class Operations {

    private Operations() {
    }

    /**
     * Terminates the population once it reaches {@code maxGenerations}.
     *
     * @param maxGenerations The last generation to evolve, at least 1.
     * @return The termination operation.
     */
    public static Operation maxGenerations(int maxGenerations) {
        if (maxGenerations < 1) {
            throw new ConfigurationException("maxGenerations must be at least 1, got: " + maxGenerations);
        }
        return Operation.builder("Termination: max generations")
            .impl((population, context) -> population.generation() >= maxGenerations
                ? population.terminate()
                : population)
            .build();
    }

    /**
     * Splits the population into parts, runs each part through the corresponding pipeline and
     * joins the results.
     *
     * <p>The operation requires fitness if the first operation of any branch does. It accepts
     * the representations every branch accepts, and produces the single explicit output
     * representation among the branches (or the input's if none declares one).</p>
     *
     * @param split     Splits the population into exactly {@code pipelines.size()} parts.
     * @param pipelines The branch pipelines, at least one.
     * @param join      Combines the branch results.
     * @return The flow operation.
     * @throws ConfigurationException if the branches declare different output representations.
     */
    public static Operation splitJoin(Function<Population, List<Population>> split,
                                      List<Pipeline> pipelines,
                                      Function<List<Population>, Population> join) {
        if (pipelines.isEmpty()) {
            throw new ConfigurationException("split join needs at least one pipeline");
        }
        List<Pipeline> branches = List.copyOf(pipelines);
        Operation.Builder builder = Operation.builder("Flow: split join")
            .requiresFitness(branches.stream().anyMatch(Operations::firstRequiresFitness))
            .impl((population, context) -> {
                List<Population> parts = split.apply(population);
                if (parts.size() != branches.size()) {
                    throw new IllegalStateException(String.format(
                        "split produced %d parts for %d pipelines", parts.size(), branches.size()));
                }
                List<Population> results = new ArrayList<>(parts.size());
                for (int i = 0; i < parts.size(); i++) {
                    results.add(branches.get(i).apply(parts.get(i), context));
                }
                return join.apply(results);
            });
        applyCommonRepresentations(builder, branches);
        return builder.build();
    }

    /**
     * Runs the population through {@code onTrue} if the predicate holds, {@code onFalse}
     * otherwise. Representation rules are the same as for {@link #splitJoin}.
     */
    public static Operation ifElse(Predicate<Population> predicate, Pipeline onTrue, Pipeline onFalse) {
        List<Pipeline> branches = List.of(onTrue, onFalse);
        Operation.Builder builder = Operation.builder("Flow: if")
            .impl((population, context) -> predicate.test(population)
                ? onTrue.apply(population, context)
                : onFalse.apply(population, context));
        applyCommonRepresentations(builder, branches);
        return builder.build();
    }

    private static boolean firstRequiresFitness(Pipeline pipeline) {
        return !pipeline.isEmpty() && pipeline.operations().get(0).requiresFitness();
    }

    private static void applyCommonRepresentations(Operation.Builder builder, List<Pipeline> branches) {
        Set<RepresentationTag> accepted = null;
        Set<RepresentationTag> outputs = new LinkedHashSet<>();
        for (Pipeline branch : branches) {
            if (branch.isEmpty()) {
                continue;
            }
            List<Operation> operations = branch.operations();
            Operation first = operations.get(0);
            if (!first.acceptsAnyRepresentation()) {
                if (accepted == null) {
                    accepted = new LinkedHashSet<>(first.inRepresentations());
                } else {
                    accepted.retainAll(first.inRepresentations());
                }
            }
            Operation last = operations.get(operations.size() - 1);
            if (last.hasOutRepresentation()) {
                outputs.add(last.outRepresentation());
            }
        }

        if (accepted != null) {
            builder.inRepresentations(accepted);
        }
        if (outputs.size() > 1) {
            throw new ConfigurationException(
                "pipelines must have the same output representation, but got: " + outputs);
        }
        if (outputs.size() == 1) {
            builder.outRepresentation(outputs.iterator().next());
        }
    }
}

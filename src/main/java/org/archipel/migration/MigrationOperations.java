package org.archipel.migration;

import org.archipel.evolution.Operation;
import org.archipel.evolution.OperationContext;
import org.archipel.evolution.Pipeline;
import org.archipel.evolution.Population;
import org.archipel.runner.WorkerAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntFunction;

/**
 * Operations exchanging individuals between populations of the same run (island model).
 *
 * <p>Both operations are no-ops outside of a run with more than one population and in
 * generations that are not a multiple of their interval. Since populations evolve at their
 * own pace, a batch may be received at a different generation than it was sent at.</p>
 */
public final class MigrationOperations {

    private static final Logger log = LoggerFactory.getLogger(MigrationOperations.class);

    private MigrationOperations() {
    }

    public static Operation emigrate(Operation selection, ITopology topology) {
        return emigrate(selection, topology, EmigrationOptions.DEFAULTS);
    }

    /**
     * Sends copies of selected individuals to randomly chosen neighbours.
     *
     * <p>The emigrants are the genomes {@code selection} picks. They are sent to distinct
     * neighbours; if the topology yields fewer neighbours than drawn, nothing is sent. The
     * sender's own population is returned unchanged.</p>
     *
     * @param selection Picks the emigrants.
     * @param topology  Determines the neighbours.
     * @param options   Interval and number of targets.
     * @return The emigration operation.
     */
    public static Operation emigrate(Operation selection, ITopology topology, EmigrationOptions options) {
        Pipeline selectionPipeline = Pipeline.of(selection);
        return Operation.builder("Multi-population: emigration")
            .impl((population, context) -> {
                if (!isMigrationGeneration(population, context, options.interval())) {
                    return population;
                }
                List<Integer> neighbours = topology.neighbours(context.numPopulations(), context.selfIndex());
                int numTargets = options.targets().draw(random());
                if (numTargets == 0 || neighbours.size() < numTargets) {
                    return population;
                }

                List<Integer> shuffled = new ArrayList<>(neighbours);
                Collections.shuffle(shuffled, random());
                Population emigrants = selectionPipeline.apply(population, context);
                Migrants migrants = new Migrants(context.self(), population.generation(), emigrants.genomes());
                for (Integer index : shuffled.subList(0, numTargets)) {
                    WorkerAddress target = context.roster().get(index);
                    log.debug("Population {} sends {} emigrants to {} at generation {}",
                        context.selfIndex(), emigrants.size(), target, population.generation());
                    context.router().deliver(target, migrants);
                }
                return population;
            })
            .build();
    }

    public static Operation immigrate(IntFunction<Operation> sizeToSelection) {
        return immigrate(sizeToSelection, ImmigrationOptions.DEFAULTS);
    }

    /**
     * Replaces part of the population with received migrants.
     *
     * <p>The population is first shrunk to {@code max(0, size - immigrants)} individuals using
     * the selection {@code sizeToSelection} returns for that size, then the immigrants are
     * appended. When blocking, the operation waits up to the timeout for a batch; otherwise it
     * only takes a batch that is already queued.</p>
     *
     * @param sizeToSelection Returns a selection keeping the given number of individuals.
     * @param options         Interval, blocking mode and timeout.
     * @return The immigration operation; it always invalidates fitness.
     * @throws MigrationTimeoutException at run time if a blocking wait expires.
     */
    public static Operation immigrate(IntFunction<Operation> sizeToSelection, ImmigrationOptions options) {
        return Operation.builder("Multi-population: immigration")
            .invalidatesFitness(true)
            .impl((population, context) -> {
                if (!isMigrationGeneration(population, context, options.interval())) {
                    return population;
                }
                Optional<Migrants> received = options.blocking()
                    ? context.mailbox().poll(options.timeout())
                    : context.mailbox().poll();
                if (received.isEmpty()) {
                    if (options.blocking()) {
                        throw new MigrationTimeoutException(options.timeout());
                    }
                    return population;
                }

                Population immigrants = Population.of(received.get().genomes(), population.representation());
                int keep = Math.max(0, population.size() - immigrants.size());
                Population shrunk = Pipeline.of(sizeToSelection.apply(keep)).apply(population, context);
                log.debug("Population {} received {} immigrants from {} at generation {}",
                    context.selfIndex(), immigrants.size(), received.get().sender(), population.generation());
                return Population.concatenate(List.of(shrunk, immigrants));
            })
            .build();
    }

    private static boolean isMigrationGeneration(Population population, OperationContext context, int interval) {
        return context.numPopulations() > 1 && population.generation() % interval == 0;
    }

    private static Random random() {
        return ThreadLocalRandom.current();
    }
}

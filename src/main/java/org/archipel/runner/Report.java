package org.archipel.runner;

import org.archipel.evolution.BestIndividual;
import org.archipel.evolution.Population;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The result of a run: its wall-clock time and one report per population, ordered by
 * population index.
 *
 * @param totalTimeUs       The duration of the whole run in microseconds.
 * @param populationReports The population reports.
 */
public record Report(long totalTimeUs, List<PopulationReport> populationReports) implements Serializable {

    public Report {
        populationReports = List.copyOf(populationReports);
    }

    /**
     * Returns the fittest individual logged by any population, if any population logs one.
     */
    public Optional<BestIndividual> bestIndividual() {
        return populationReports.stream()
            .map(report -> report.population().log().get(Population.BEST_INDIVIDUAL_LOG_KEY))
            .filter(BestIndividual.class::isInstance)
            .map(BestIndividual.class::cast)
            .max(Comparator.comparingDouble(BestIndividual::fitness));
    }

    /**
     * Renders a human-readable summary: run times, mean generations and, when available,
     * the best individual.
     */
    public String formatSummary() {
        double meanTime = populationReports.stream().mapToLong(PopulationReport::timeUs).average().orElse(0);
        double meanGenerations = populationReports.stream()
            .mapToInt(report -> report.population().generation()).average().orElse(0);

        StringBuilder summary = new StringBuilder()
            .append("──── Summary ────\n\n")
            .append("Total time: ").append(formatSeconds(totalTimeUs)).append("s\n")
            .append("Populations: ").append(populationReports.size()).append('\n')
            .append("Population time (mean): ").append(formatSeconds(Math.round(meanTime))).append("s\n")
            .append("Generations (mean): ").append(Math.round(meanGenerations));

        bestIndividual().ifPresent(best -> summary
            .append("\n\n──── Best individual ────\n\n")
            .append("Fitness: ").append(best.fitness()).append('\n')
            .append("Generation: ").append(best.generation()).append('\n')
            .append("Genome: ").append(formatGenome(best.genome())));
        return summary.toString();
    }

    private static String formatSeconds(long timeUs) {
        return String.format(Locale.ROOT, "%.3f", timeUs / 1_000_000.0);
    }

    private static String formatGenome(Object genome) {
        if (genome != null && genome.getClass().isArray()) {
            String wrapped = Arrays.deepToString(new Object[] {genome});
            return wrapped.substring(1, wrapped.length() - 1);
        }
        return String.valueOf(genome);
    }
}

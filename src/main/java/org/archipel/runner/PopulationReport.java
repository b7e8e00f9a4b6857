package org.archipel.runner;

import org.archipel.evolution.Population;

import java.io.Serializable;

/**
 * The outcome of one population.
 *
 * @param worker     The worker that evolved the population.
 * @param timeUs     Time from roster receipt to termination, in microseconds.
 * @param population The final (terminated) population.
 */
public record PopulationReport(WorkerAddress worker, long timeUs, Population population) implements Serializable {
}

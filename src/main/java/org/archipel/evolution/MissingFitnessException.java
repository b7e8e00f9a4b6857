package org.archipel.evolution;

/**
 * Thrown when an operation that requires fitness is applied to a population whose fitness has
 * not been computed. Pipelines compute fitness lazily before such operations, so this signals
 * an operation that misreports its own contract.
 */
public class MissingFitnessException extends IllegalStateException {

    public MissingFitnessException(String operationName) {
        super(String.format("operation \"%s\" requires fitness, but it has not been computed", operationName));
    }
}

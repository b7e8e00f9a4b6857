package org.archipel.evolution;

/**
 * Thrown when an operation without an explicit output representation is used to initialize
 * a population.
 */
public class InvalidInitializerException extends ConfigurationException {

    public InvalidInitializerException(String operationName) {
        super(String.format("expected an initializer operation, got: \"%s\"", operationName));
    }
}

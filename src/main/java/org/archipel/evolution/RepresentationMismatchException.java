package org.archipel.evolution;

/**
 * Thrown when an operation in a pipeline does not accept the representation produced by the
 * operations before it.
 */
public class RepresentationMismatchException extends ConfigurationException {

    private final String operationName;
    private final RepresentationTag representation;

    public RepresentationMismatchException(String operationName, RepresentationTag representation) {
        super(String.format("representation mismatch, \"%s\" does not accept %s", operationName, representation));
        this.operationName = operationName;
        this.representation = representation;
    }

    public String getOperationName() {
        return operationName;
    }

    public RepresentationTag getRepresentation() {
        return representation;
    }
}

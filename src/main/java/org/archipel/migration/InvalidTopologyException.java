package org.archipel.migration;

import org.archipel.evolution.ConfigurationException;

/**
 * Thrown when an adjacency map does not describe a valid topology.
 */
public class InvalidTopologyException extends ConfigurationException {

    public InvalidTopologyException(String message) {
        super(message);
    }
}

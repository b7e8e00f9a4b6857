package org.archipel.evolution;

import java.util.Collection;

/**
 * Thrown when populations of different representations are joined into one.
 */
public class IncompatibleRepresentationException extends ConfigurationException {

    public IncompatibleRepresentationException(Collection<RepresentationTag> representations) {
        super("cannot join populations with different representations: " + representations);
    }
}

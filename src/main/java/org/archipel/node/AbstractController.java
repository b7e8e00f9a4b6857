package org.archipel.node;

/**
 * Base class for controllers, giving every controller access to the {@link Cluster} it
 * serves.
 */
public abstract class AbstractController implements IController {

    protected final Cluster cluster;

    protected AbstractController(final Cluster cluster) {
        this.cluster = cluster;
    }
}

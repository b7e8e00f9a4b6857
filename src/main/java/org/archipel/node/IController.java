package org.archipel.node;

import io.javalin.Javalin;

/**
 * A group of HTTP routes served by the {@link NodeServer}.
 */
public interface IController {

    /**
     * Registers all HTTP routes of this controller.
     *
     * @param app The Javalin application instance to register routes with.
     */
    void registerRoutes(Javalin app);
}

package org.archipel.node;

import io.javalin.Javalin;
import io.javalin.http.HttpStatus;
import org.archipel.node.dto.ErrorResponseDto;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The Javalin HTTP server every participating process runs. Controllers contribute the
 * routes; the server maps exceptions to error responses.
 */
public class NodeServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeServer.class);

    private final String name;
    private final String host;
    private final int port;
    private final List<IController> controllers;
    private Javalin app;

    /**
     * @param name        Used to name the request threads.
     * @param host        The interface to bind to.
     * @param port        The port to listen on, 0 for any free port.
     * @param controllers The route providers.
     */
    public NodeServer(final String name, final String host, final int port, final List<IController> controllers) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.controllers = List.copyOf(controllers);
    }

    /**
     * Starts the server.
     *
     * @return The port the server listens on.
     * @throws IllegalStateException if the server is already running.
     */
    public synchronized int start() {
        if (app != null) {
            throw new IllegalStateException("node server '" + name + "' is already running");
        }

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
                }
            });
            final QueuedThreadPool threadPool = new QueuedThreadPool(64, 4, 60000);
            threadPool.setName(name + "-http");
            config.jetty.threadPool = threadPool;
        });

        for (final IController controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);

        app.start(host, port);
        LOGGER.debug("Node server '{}' started on {}:{}", name, host, app.port());
        return app.port();
    }

    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.debug("Node server '{}' stopped", name);
        }
    }

    private static void registerExceptionHandlers(final Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Bad request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(), HttpStatus.BAD_REQUEST.getMessage(), e.getMessage()));
        });
        app.exception(IllegalStateException.class, (e, ctx) -> {
            LOGGER.warn("Conflict for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(HttpStatus.CONFLICT).json(ErrorResponseDto.of(
                HttpStatus.CONFLICT.getCode(), HttpStatus.CONFLICT.getMessage(), e.getMessage()));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            LOGGER.debug("Exception details:", e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(), HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                "An internal server error occurred."));
        });
    }
}

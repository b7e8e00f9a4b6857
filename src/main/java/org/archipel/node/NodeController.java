package org.archipel.node;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.archipel.node.dto.ErrorResponseDto;
import org.archipel.node.dto.InitiateRequestDto;
import org.archipel.node.dto.PingResponseDto;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Liveness and name lookup, the routes the bootstrap handshake relies on.
 * <ul>
 *   <li>{@code GET /ping}</li>
 *   <li>{@code GET /registry/{name}}: 200 if registered, 404 otherwise</li>
 *   <li>{@code POST /initiate}: hands the leader identity to a registered process</li>
 * </ul>
 */
public class NodeController extends AbstractController {

    public NodeController(final Cluster cluster) {
        super(cluster);
    }

    @Override
    public void registerRoutes(final Javalin app) {
        app.get("/ping", this::handlePing);
        app.get("/registry/{name}", this::handleLookup);
        app.post("/initiate", this::handleInitiate);
    }

    void handlePing(final Context ctx) {
        ctx.status(HttpStatus.OK).json(new PingResponseDto(cluster.self().toString(), "UP", cluster.registry().size()));
    }

    void handleLookup(final Context ctx) {
        final String name = ctx.pathParam("name");
        if (cluster.directory().isRegistered(name)) {
            ctx.status(HttpStatus.OK).json(Map.of("name", name, "node", cluster.self().toString()));
        } else {
            notFound(ctx, "no process registered as '" + name + "'");
        }
    }

    void handleInitiate(final Context ctx) {
        final InitiateRequestDto request = ctx.bodyAsClass(InitiateRequestDto.class);
        if (request.name() == null || request.leader() == null) {
            throw new IllegalArgumentException("initiate requires a name and a leader");
        }
        final Consumer<NodeId> handler = cluster.directory().lookup(request.name()).orElse(null);
        if (handler == null) {
            notFound(ctx, "no process registered as '" + request.name() + "'");
            return;
        }
        handler.accept(request.leader());
        ctx.status(HttpStatus.ACCEPTED);
    }

    private static void notFound(final Context ctx, final String message) {
        ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(
            HttpStatus.NOT_FOUND.getCode(), HttpStatus.NOT_FOUND.getMessage(), message));
    }
}

package org.archipel.node;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.archipel.evolution.Model;
import org.archipel.migration.Migrants;
import org.archipel.node.dto.ErrorResponseDto;
import org.archipel.node.dto.SpawnRequestDto;
import org.archipel.node.dto.SpawnResponseDto;
import org.archipel.runner.IReportSink;
import org.archipel.runner.LocalRun;
import org.archipel.runner.PopulationReport;
import org.archipel.runner.Roster;
import org.archipel.runner.WorkerAddress;
import org.archipel.runner.WorkerFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Routes for hosting populations of runs coordinated by another node.
 * <ul>
 *   <li>{@code POST /runs/{runId}/spawn}: rebuild the model and spawn workers (JSON)</li>
 *   <li>{@code POST /runs/{runId}/roster}: release the spawned workers (JSON)</li>
 *   <li>{@code POST /runs/{runId}/mailboxes/{index}}: deliver migrants (serialized)</li>
 *   <li>{@code POST /runs/{runId}/reports/{index}}: a population finished (serialized)</li>
 *   <li>{@code POST /runs/{runId}/failures/{index}}: a population failed (serialized)</li>
 *   <li>{@code POST /runs/{runId}/cancel}: interrupt the local workers of a run</li>
 * </ul>
 */
public class RunController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunController.class);

    public RunController(final Cluster cluster) {
        super(cluster);
    }

    @Override
    public void registerRoutes(final Javalin app) {
        final String runPath = "/runs/{runId}";
        app.post(runPath + "/spawn", this::handleSpawn);
        app.post(runPath + "/roster", this::handleRoster);
        app.post(runPath + "/mailboxes/{index}", this::handleMigrants);
        app.post(runPath + "/reports/{index}", this::handleReport);
        app.post(runPath + "/failures/{index}", this::handleFailure);
        app.post(runPath + "/cancel", this::handleCancel);
    }

    void handleSpawn(final Context ctx) {
        final String runId = ctx.pathParam("runId");
        final SpawnRequestDto request = ctx.bodyAsClass(SpawnRequestDto.class);
        final Model model = new ModelSource(request.providerClass(), request.options()).load();
        final List<Integer> indices = request.indices() == null ? List.of() : request.indices();

        final IReportSink sink = new RemoteReportSink(cluster, runId, request.leader(), indices.size());
        final LocalRun localRun = new LocalRun(runId, cluster.self(), model, indices,
            cluster.runnerOptions(), sink, cluster.remoteRouter(runId));
        cluster.registry().host(localRun, null);
        final List<WorkerAddress> workers;
        try {
            workers = localRun.spawn();
        } catch (final RuntimeException e) {
            cluster.registry().release(runId);
            throw e;
        }
        LOGGER.info("Hosting populations {} of run {} for leader {}", indices, runId, request.leader());
        ctx.status(HttpStatus.CREATED).json(new SpawnResponseDto(workers));
    }

    void handleRoster(final Context ctx) {
        final Roster roster = ctx.bodyAsClass(Roster.class);
        final Optional<LocalRun> run = cluster.registry().run(ctx.pathParam("runId"));
        if (run.isEmpty()) {
            unknownRun(ctx);
            return;
        }
        run.get().assignRoster(roster);
        ctx.status(HttpStatus.ACCEPTED);
    }

    void handleMigrants(final Context ctx) {
        final Optional<LocalRun> run = cluster.registry().run(ctx.pathParam("runId"));
        if (run.isEmpty()) {
            unknownRun(ctx);
            return;
        }
        final Migrants migrants = PayloadCodec.decode(ctx.bodyAsBytes(), Migrants.class, cluster.payloadFilter());
        run.get().deliver(Integer.parseInt(ctx.pathParam("index")), migrants);
        ctx.status(HttpStatus.ACCEPTED);
    }

    void handleReport(final Context ctx) {
        final Optional<IReportSink> tracker = cluster.registry().tracker(ctx.pathParam("runId"));
        if (tracker.isEmpty()) {
            unknownRun(ctx);
            return;
        }
        tracker.get().reportCompleted(PayloadCodec.decode(ctx.bodyAsBytes(), PopulationReport.class, cluster.payloadFilter()));
        ctx.status(HttpStatus.ACCEPTED);
    }

    void handleFailure(final Context ctx) {
        final Optional<IReportSink> tracker = cluster.registry().tracker(ctx.pathParam("runId"));
        if (tracker.isEmpty()) {
            unknownRun(ctx);
            return;
        }
        final WorkerFailure failure = PayloadCodec.decode(ctx.bodyAsBytes(), WorkerFailure.class, cluster.payloadFilter());
        tracker.get().reportFailed(failure.worker(), failure.cause());
        ctx.status(HttpStatus.ACCEPTED);
    }

    void handleCancel(final Context ctx) {
        final String runId = ctx.pathParam("runId");
        final Optional<LocalRun> run = cluster.registry().run(runId);
        if (run.isEmpty()) {
            unknownRun(ctx);
            return;
        }
        cluster.registry().release(runId);
        run.get().cancel();
        ctx.status(HttpStatus.ACCEPTED);
    }

    private static void unknownRun(final Context ctx) {
        ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(HttpStatus.NOT_FOUND.getCode(),
            HttpStatus.NOT_FOUND.getMessage(), "run " + ctx.pathParam("runId") + " is not hosted on this node"));
    }
}

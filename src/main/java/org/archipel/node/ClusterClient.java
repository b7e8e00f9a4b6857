package org.archipel.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.archipel.migration.Migrants;
import org.archipel.node.dto.InitiateRequestDto;
import org.archipel.node.dto.SpawnRequestDto;
import org.archipel.node.dto.SpawnResponseDto;
import org.archipel.runner.PopulationReport;
import org.archipel.runner.Roster;
import org.archipel.runner.WorkerAddress;
import org.archipel.runner.WorkerFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Serializable;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the routes of peer {@link NodeServer}s.
 *
 * <p>Handshake calls ({@link #ping}, {@link #lookup}, {@link #initiate}) report failures as
 * {@code false}, since the bootstrap retries them. Run calls throw
 * {@link NodeCommunicationException}.</p>
 */
public class ClusterClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterClient.class);
    private static final String OCTET_STREAM = "application/octet-stream";
    private static final String JSON = "application/json";

    private final HttpClient client;
    private final Duration requestTimeout;
    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @param httpOptions The {@code archipel.node.http} configuration section.
     */
    public ClusterClient(final Config httpOptions) {
        this(httpOptions.getDuration("connect-timeout"), httpOptions.getDuration("request-timeout"));
    }

    public ClusterClient(final Duration connectTimeout, final Duration requestTimeout) {
        this.client = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        this.requestTimeout = requestTimeout;
    }

    /**
     * @return {@code true} if the node server answered.
     */
    public boolean ping(final NodeId node) throws InterruptedException {
        try {
            return send(get(node, "/ping")).statusCode() == 200;
        } catch (final IOException e) {
            LOGGER.debug("Ping to {} failed: {}", node, e.getMessage());
            return false;
        }
    }

    /**
     * @return {@code true} if {@code name} is registered on the node.
     */
    public boolean lookup(final NodeId node, final String name) throws InterruptedException {
        try {
            return send(get(node, "/registry/" + encode(name))).statusCode() == 200;
        } catch (final IOException e) {
            LOGGER.debug("Lookup of '{}' on {} failed: {}", name, node, e.getMessage());
            return false;
        }
    }

    /**
     * Sends the initiate message to the process registered under {@code name}.
     *
     * @return {@code true} if the process accepted it.
     */
    public boolean initiate(final NodeId node, final String name, final NodeId leader) throws InterruptedException {
        try {
            final HttpResponse<byte[]> response = send(post(node, "/initiate", JSON,
                toJson(new InitiateRequestDto(name, leader))));
            return response.statusCode() == 202;
        } catch (final IOException e) {
            LOGGER.debug("Initiate of '{}' on {} failed: {}", name, node, e.getMessage());
            return false;
        }
    }

    public List<WorkerAddress> spawn(final NodeId node, final String runId, final SpawnRequestDto request) {
        final HttpResponse<byte[]> response = exchange(node,
            post(node, runPath(runId, "/spawn"), JSON, toJson(request)), 201);
        try {
            return mapper.readValue(response.body(), SpawnResponseDto.class).workers();
        } catch (final IOException e) {
            throw new NodeCommunicationException(node, "invalid spawn response: " + e.getMessage(), e);
        }
    }

    public void sendRoster(final NodeId node, final Roster roster) {
        exchange(node, post(node, runPath(roster.runId(), "/roster"), JSON, toJson(roster)), 202);
    }

    /**
     * Delivers migrants to a worker on another node. A target that no longer hosts the run
     * has finished, so the batch is discarded.
     */
    public void sendMigrants(final WorkerAddress target, final String runId, final Migrants migrants) {
        final NodeId node = target.node();
        final HttpResponse<byte[]> response = exchange(node,
            post(node, runPath(runId, "/mailboxes/" + target.index()), OCTET_STREAM, PayloadCodec.encode(migrants)),
            202, 404);
        if (response.statusCode() == 404) {
            LOGGER.debug("Worker {} of run {} is gone, discarding migrants", target, runId);
        }
    }

    public void sendReport(final NodeId leader, final String runId, final PopulationReport report) {
        sendPayload(leader, runPath(runId, "/reports/" + report.worker().index()), report);
    }

    public void sendFailure(final NodeId leader, final String runId, final WorkerFailure failure) {
        sendPayload(leader, runPath(runId, "/failures/" + failure.worker().index()), failure);
    }

    /**
     * Asks the node to interrupt its workers of the run.
     */
    public void cancel(final NodeId node, final String runId) {
        exchange(node, post(node, runPath(runId, "/cancel"), JSON, new byte[0]), 202, 404);
    }

    private void sendPayload(final NodeId node, final String path, final Serializable payload) {
        exchange(node, post(node, path, OCTET_STREAM, PayloadCodec.encode(payload)), 202);
    }

    private HttpResponse<byte[]> exchange(final NodeId node, final HttpRequest request, final int... expected) {
        final HttpResponse<byte[]> response;
        try {
            response = send(request);
        } catch (final IOException e) {
            throw new NodeCommunicationException(node, request.method() + " " + request.uri().getPath() + ": " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeCommunicationException(node, "interrupted during " + request.uri().getPath(), e);
        }
        for (final int status : expected) {
            if (response.statusCode() == status) {
                return response;
            }
        }
        throw new NodeCommunicationException(node, String.format("%s %s answered %d: %s", request.method(),
            request.uri().getPath(), response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }

    private HttpResponse<byte[]> send(final HttpRequest request) throws IOException, InterruptedException {
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    private HttpRequest get(final NodeId node, final String path) {
        return HttpRequest.newBuilder(URI.create(node.baseUrl() + path)).timeout(requestTimeout).GET().build();
    }

    private HttpRequest post(final NodeId node, final String path, final String contentType, final byte[] body) {
        return HttpRequest.newBuilder(URI.create(node.baseUrl() + path))
            .timeout(requestTimeout)
            .header("Content-Type", contentType)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();
    }

    private byte[] toJson(final Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String runPath(final String runId, final String suffix) {
        return "/runs/" + encode(runId) + suffix;
    }

    private static String encode(final String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}

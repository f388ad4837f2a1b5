package com.bizgraph.rge.web;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.io.JsonSupport;
import com.bizgraph.rge.io.RelationshipChangeRequest;
import com.bizgraph.rge.service.ChangeAck;
import com.bizgraph.rge.service.NetworkQueryService;
import com.bizgraph.rge.service.NetworkResponse;
import com.bizgraph.rge.service.NetworkResponses;
import com.bizgraph.rge.service.QueryOutcome;
import com.bizgraph.rge.util.QueryStatsListener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;
import io.javalin.http.Context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Thin HTTP surface over {@link NetworkQueryService}.
 *
 * <pre>
 * GET  /api/v1/businesses/{id}/network
 * GET  /api/v1/businesses/{id}/neighborhood?maxDepth=
 * GET  /api/v1/paths?source=&amp;target=&amp;maxDepth=
 * POST /api/v1/relationships
 * GET  /api/v1/stats
 * </pre>
 *
 * Every request gets a fresh deadline of {@code requestBudget}. Errors are
 * rendered as {@code status: error} envelopes with the HTTP status of their
 * {@link ErrorCode}.
 */
public class NetworkQueryServer {
    private static final Logger log = LogManager.getLogger(NetworkQueryServer.class);
    private static final String JSON = "application/json";

    private final NetworkQueryService service;
    private final QueryStatsListener stats;
    private final Duration requestBudget;
    private final ObjectMapper mapper = JsonSupport.mapper();
    private Javalin app;

    public NetworkQueryServer(NetworkQueryService service, QueryStatsListener stats, Duration requestBudget) {
        this.service = service;
        this.stats = stats;
        this.requestBudget = requestBudget;
    }

    /**
     * Starts listening.
     *
     * @param port port to bind, 0 for an ephemeral one (see {@link #port()})
     */
    public void start(int port) {
        log.info("Starting network query server on port {}", port);
        app = Javalin.create();

        app.get("/api/v1/businesses/{id}/network", ctx -> {
            QueryOutcome<BusinessNetworkView> outcome = service.network(ctx.pathParam("id"), deadline());
            respond(ctx, 200, NetworkResponses.network(outcome));
        });

        app.get("/api/v1/businesses/{id}/neighborhood", ctx -> {
            String id = ctx.pathParam("id");
            Deadline deadline = deadline();
            QueryOutcome<Neighborhood> outcome = service.neighborhood(id, depth(ctx), deadline);
            BusinessNode source = service.business(id, deadline).orElse(null);
            respond(ctx, 200, NetworkResponses.neighborhood(source, outcome));
        });

        app.get("/api/v1/paths", ctx -> {
            String source = ctx.queryParam("source");
            Deadline deadline = deadline();
            QueryOutcome<PathResult> outcome = service.findPath(source, ctx.queryParam("target"), depth(ctx),
                    deadline);
            BusinessNode node = service.business(source, deadline).orElse(null);
            respond(ctx, 200, NetworkResponses.path(node, outcome));
        });

        app.post("/api/v1/relationships", ctx -> {
            RelationshipChangeRequest request = mapper.readValue(ctx.body(), RelationshipChangeRequest.class);
            ChangeAck ack = service.applyRelationshipChange(request.toChange(Instant.now()), deadline());
            respond(ctx, ack.kind() == ChangeKind.CREATED && ack.applied() ? 201 : 200, ackBody(ack));
        });

        app.get("/api/v1/stats", ctx -> respond(ctx, 200, stats.toMap()));

        app.exception(GraphQueryException.class, (e, ctx) -> {
            log.debug("Request {} failed: {}", ctx.path(), e.getMessage());
            respond(ctx, e.code().httpStatus(), NetworkResponses.error(e));
        });
        app.exception(JsonProcessingException.class, (e, ctx) -> respond(ctx, 400,
                NetworkResponses.error(ErrorCode.INVALID_ARGUMENT, "Malformed request body: " + e.getOriginalMessage())));
        app.exception(IllegalArgumentException.class, (e, ctx) -> respond(ctx, 400,
                NetworkResponses.error(ErrorCode.INVALID_ARGUMENT, e.getMessage())));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error serving {}", ctx.path(), e);
            respond(ctx, 500, NetworkResponses.error(ErrorCode.INTERNAL, "Internal error"));
        });

        app.start(port);
    }

    /** Bound port; only meaningful after {@link #start(int)}. */
    public int port() {
        return app == null ? -1 : app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            log.info("Network query server stopped");
        }
    }

    private Deadline deadline() {
        return Deadline.after(requestBudget);
    }

    private int depth(Context ctx) {
        String raw = ctx.queryParam("maxDepth");
        if (raw == null || raw.isBlank())
            return service.limits().defaultMaxDepth();
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxDepth must be an integer: " + raw, e);
        }
    }

    private static Map<String, Object> ackBody(ChangeAck ack) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("change", ack.kind().name().toLowerCase(Locale.ROOT));
        data.put("applied", ack.applied());
        data.put("store_version", ack.storeVersion());
        data.put("invalidation_applied", ack.invalidationApplied());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", NetworkResponse.SUCCESS);
        body.put("data", data);
        return body;
    }

    private void respond(Context ctx, int status, Object body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response", e);
        }
        ctx.status(status).contentType(JSON).result(json);
    }
}

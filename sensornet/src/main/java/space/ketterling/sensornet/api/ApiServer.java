/*
* Copyright 2025 Taylor Ketterling
* API Server for the sensor network service: metadata, observations,
* aggregates and datadump exports for environmental sensor networks.
* utalizes Javalin for HTTP server, Jackson for JSON processing and
* HikariCP for database connection pooling.
*/

package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.aggregate.UnprocessableQueryException;
import space.ketterling.sensornet.config.AppConfig;
import space.ketterling.sensornet.export.ExportJobQueue;
import space.ketterling.sensornet.export.JobStatusStore;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.EmptyResolutionException;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.query.ObservationService;
import space.ketterling.sensornet.schema.FeatureTableException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final MetadataResolver resolver;
    private final ObservationService observations;
    private final ResultFormatter formatter;
    private final RequestValidator validator;
    private final ExportJobQueue exports;
    private final JobStatusStore jobs;
    private final ResponseCache cache;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds, MetadataResolver resolver,
            ObservationService observations, ResultFormatter formatter, RequestValidator validator,
            ExportJobQueue exports, JobStatusStore jobs, ResponseCache cache) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.resolver = resolver;
        this.observations = observations;
        this.formatter = formatter;
        this.validator = validator;
        this.exports = exports;
        this.jobs = jobs;
        this.cache = cache;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        createApp().start(cfg.apiPort());
    }

    /**
     * Builds the Javalin app with every route registered, without binding a
     * port.
     */
    public Javalin createApp() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        registerErrorHandlers();

        ApiRoutesRoot.register(this);
        ApiRoutesMetadata.register(this);
        ApiRoutesObservations.register(this);
        ApiRoutesJobs.register(this);
        return app;
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    private void registerErrorHandlers() {
        app.exception(ValidationException.class, (e, ctx) -> {
            log.info("Rejected {} {}: {}", ctx.method(), ctx.path(), e.errors());
            ObjectNode body = om.createObjectNode().put("error", "validation_error");
            body.set("errors", om.valueToTree(e.errors()));
            ctx.status(400).json(body);
        });

        app.exception(EmptyResolutionException.class, (e, ctx) -> {
            log.info("Empty resolution on {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ObjectNode body = om.createObjectNode()
                    .put("error", "empty_resolution")
                    .put("message", e.getMessage())
                    .put("level", e.level().label());
            body.set("values", om.valueToTree(e.values()));
            if (e.upstreamLevel() != null) {
                body.put("upstream_level", e.upstreamLevel().label());
                body.set("upstream_values", om.valueToTree(e.upstreamValues()));
            }
            ctx.status(400).json(body);
        });

        app.exception(UnprocessableQueryException.class, (e, ctx) -> {
            log.info("Unprocessable {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(422).json(om.createObjectNode()
                    .put("error", "unprocessable_query")
                    .put("message", e.getMessage()));
        });

        app.exception(FeatureTableException.class, (e, ctx) -> {
            log.error("Observation table error on {} {} (feature {})", ctx.method(), ctx.path(), e.feature(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "feature_table_error")
                    .put("message", e.getMessage()));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });
    }

    // --------------------------------------------------------------------
    // Accessors for route registrars
    // --------------------------------------------------------------------
    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    AppConfig cfg() {
        return cfg;
    }

    MetadataResolver resolver() {
        return resolver;
    }

    ObservationService observations() {
        return observations;
    }

    ResultFormatter formatter() {
        return formatter;
    }

    RequestValidator validator() {
        return validator;
    }

    ExportJobQueue exports() {
        return exports;
    }

    JobStatusStore jobs() {
        return jobs;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    /**
     * Query parameters (first value of each) merged with the path
     * parameters; path parameters win.
     */
    Map<String, String> params(Context ctx) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : ctx.queryParamMap().entrySet()) {
            if (!e.getValue().isEmpty())
                out.put(e.getKey(), e.getValue().get(0));
        }
        out.putAll(ctx.pathParamMap());
        return out;
    }

    /**
     * Path plus sorted query parameters, so equivalent requests share an entry.
     */
    static String cacheKey(Context ctx) {
        return ctx.path() + "?" + new TreeMap<>(ctx.queryParamMap());
    }

    boolean serveCached(Context ctx, String key) {
        ResponseCache.CachedResponse cached = cache.get(key);
        if (cached == null) {
            return false;
        }

        String inm = ctx.header("If-None-Match");
        applyCacheHeaders(ctx, cached.maxAgeSeconds());
        ctx.header("ETag", cached.etag());
        if (cached.etag().equals(inm)) {
            ctx.status(304);
            return true;
        }

        ctx.contentType("application/json");
        ctx.result(cached.body());
        return true;
    }

    void cacheAndRespond(Context ctx, String key, JsonNode node) throws Exception {
        String body = om.writeValueAsString(node);
        ResponseCache.CachedResponse stored = cache.put(key, body);
        applyCacheHeaders(ctx, stored.maxAgeSeconds());
        ctx.header("ETag", stored.etag());
        ctx.contentType("application/json");
        ctx.result(body);
    }

    void respond(Context ctx, JsonNode node) throws Exception {
        ctx.contentType("application/json");
        ctx.result(om.writeValueAsString(node));
    }

    private void applyCacheHeaders(Context ctx, int maxAgeSeconds) {
        if (maxAgeSeconds <= 0) {
            return;
        }
        ctx.header("Cache-Control", "public, max-age=" + maxAgeSeconds);
    }
}
